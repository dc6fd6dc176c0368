package org.Aayush.solver.priority;

import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;

/**
 * Surplus ranking: {@code sellAmount·price(sell) - buyAmount·price(buy)}.
 */
final class ExternalSurplusSorting implements SortingStrategy {
    private final double minFraction;

    ExternalSurplusSorting(double minFraction) {
        this.minFraction = SortingSupport.validateFraction(minFraction);
    }

    @Override
    public String id() {
        return "EXTERNAL_SURPLUS";
    }

    @Override
    public double minFraction() {
        return minFraction;
    }

    @Override
    public Comparator<Order> comparator(Map<Token, BigDecimal> prices, Instant now) {
        return SortingSupport.descendingNullsLast(order -> {
            BigDecimal sold = SortingSupport.value(order.getSellAmount(), order.getSellToken(), prices);
            BigDecimal bought = SortingSupport.value(order.getBuyAmount(), order.getBuyToken(), prices);
            return sold == null || bought == null ? null : sold.subtract(bought);
        });
    }
}
