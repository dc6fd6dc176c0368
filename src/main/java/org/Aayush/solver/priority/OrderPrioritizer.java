package org.Aayush.solver.priority;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.solver.core.time.SolveClock;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Selects and sequences the orders a solve works on.
 *
 * <p>Selection runs in two phases:</p>
 * <ol>
 * <li>Every strategy with {@code minFraction > 0}, in configured order, contributes its
 * {@code ceil(minFraction · maxOrders)} top-ranked orders, skipping orders already selected.</li>
 * <li>Remaining capacity is filled from the ranking of all strategies combined
 * lexicographically.</li>
 * </ol>
 * <p>Sorting is stable, so ties keep arrival sequence. With no strategies the arrival sequence
 * is preserved and only the {@code maxOrders} cap applies. The result never exceeds
 * {@code maxOrders}.</p>
 */
@Slf4j
public final class OrderPrioritizer {
    private final List<SortingStrategy> strategies;
    private final SolveClock clock;

    public OrderPrioritizer(List<SortingStrategy> strategies, SolveClock clock) {
        this.strategies = List.copyOf(Objects.requireNonNull(strategies, "strategies"));
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Prioritizer that keeps arrival sequence.
     */
    public static OrderPrioritizer arrivalOrder() {
        return new OrderPrioritizer(List.of(), SolveClock.system());
    }

    public List<SortingStrategy> strategies() {
        return strategies;
    }

    /**
     * Ranks and caps {@code orders}.
     *
     * @param orders orders in arrival sequence.
     * @param prices reference prices used by price-based strategies.
     * @param maxOrders maximum number of orders kept; must be {@code > 0}.
     * @return selected orders in solving sequence.
     */
    public List<Order> prioritize(List<Order> orders, Map<Token, BigDecimal> prices, int maxOrders) {
        Objects.requireNonNull(orders, "orders");
        Objects.requireNonNull(prices, "prices");
        if (maxOrders <= 0) {
            throw new IllegalArgumentException("maxOrders must be > 0, got " + maxOrders);
        }
        if (strategies.isEmpty()) {
            return orders.size() <= maxOrders ? List.copyOf(orders) : List.copyOf(orders.subList(0, maxOrders));
        }

        Instant now = clock.now();
        List<Order> selected = new ArrayList<>(Math.min(orders.size(), maxOrders));
        Set<String> selectedIds = new HashSet<>();
        for (SortingStrategy strategy : strategies) {
            if (strategy.minFraction() <= 0.0d) {
                continue;
            }
            List<Order> ranked = new ArrayList<>(orders);
            ranked.sort(strategy.comparator(prices, now));
            int quota = (int) Math.min(ranked.size(), (long) Math.ceil(strategy.minFraction() * maxOrders));
            for (int i = 0; i < quota && selected.size() < maxOrders; i++) {
                Order order = ranked.get(i);
                if (selectedIds.add(order.getId())) {
                    selected.add(order);
                }
            }
        }

        if (selected.size() < maxOrders) {
            Comparator<Order> combined = null;
            for (SortingStrategy strategy : strategies) {
                Comparator<Order> next = strategy.comparator(prices, now);
                combined = combined == null ? next : combined.thenComparing(next);
            }
            List<Order> ranked = new ArrayList<>(orders);
            ranked.sort(combined);
            for (Order order : ranked) {
                if (selected.size() == maxOrders) {
                    break;
                }
                if (selectedIds.add(order.getId())) {
                    selected.add(order);
                }
            }
        }
        if (selected.size() < orders.size()) {
            log.debug("Prioritizer kept {} of {} orders", selected.size(), orders.size());
        }
        return List.copyOf(selected);
    }
}
