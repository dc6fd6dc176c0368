package org.Aayush.solver.routing;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.solver.domain.Fill;
import org.Aayush.solver.domain.FillSource;
import org.Aayush.solver.domain.Interaction;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.OrderKind;
import org.Aayush.solver.graph.LiquidityGraph;
import org.Aayush.solver.liquidity.DecimalMath;
import org.Aayush.solver.liquidity.ReserveOverlay;
import org.Aayush.solver.matching.Residual;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Routes residual orders one by one against simulated pool consumption.
 *
 * <p>Residuals are processed in the given sequence. Each committed route is applied to the
 * {@link ReserveOverlay} before the next order is searched, so later orders see the reserves
 * earlier orders left behind. A route is committed only when the realized exchange respects the
 * order's limit price exactly; an unreachable limit leaves the order unfilled.</p>
 *
 * <p>Partially fillable orders that cannot be routed in full are retried with the amount halved,
 * up to {@code maxPartialAttempts} attempts in total.</p>
 */
@Slf4j
public final class OrderRouter {
    private final RouteSearch routeSearch;
    private final int maxPartialAttempts;

    public OrderRouter(RouteSearch routeSearch, int maxPartialAttempts) {
        this.routeSearch = Objects.requireNonNull(routeSearch, "routeSearch");
        if (maxPartialAttempts <= 0) {
            throw new IllegalArgumentException("maxPartialAttempts must be > 0, got " + maxPartialAttempts);
        }
        this.maxPartialAttempts = maxPartialAttempts;
    }

    public RouteSearch routeSearch() {
        return routeSearch;
    }

    /**
     * Routes all residuals in sequence.
     *
     * @param graph snapshot graph.
     * @param overlay consumption state to start from.
     * @param residuals orders to route, in sequence.
     * @param maxHops hop limit per route.
     * @param splitting whether hops may be split across parallel pools.
     * @param signal cooperative cancellation.
     * @return routed fills, interactions and final overlay.
     */
    public RoutingOutcome route(
            LiquidityGraph graph,
            ReserveOverlay overlay,
            List<Residual> residuals,
            int maxHops,
            boolean splitting,
            CancellationSignal signal
    ) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(residuals, "residuals");
        Objects.requireNonNull(signal, "signal");
        ReserveOverlay current = Objects.requireNonNull(overlay, "overlay");
        RoutingOutcome.RoutingOutcomeBuilder outcome = RoutingOutcome.builder();

        for (Residual residual : residuals) {
            signal.checkpoint();
            Order order = residual.order();
            int attempts = order.isPartiallyFillable() ? maxPartialAttempts : 1;
            BigDecimal amount = residual.remaining();
            boolean routed = false;

            for (int attempt = 0; attempt < attempts && amount.signum() > 0; attempt++) {
                Route route = routeSearch.find(graph, current, query(order, amount, maxHops, splitting), signal);
                if (route != null) {
                    BigDecimal executedSell = order.getKind() == OrderKind.SELL ? amount : route.amountIn();
                    BigDecimal executedBuy = order.getKind() == OrderKind.SELL ? route.amountOut() : amount;
                    if (order.respectsLimit(executedSell, executedBuy)) {
                        for (Interaction interaction : route.interactions()) {
                            current = current.commit(
                                    interaction.poolId(),
                                    interaction.tokenIn(),
                                    interaction.amountIn(),
                                    interaction.tokenOut(),
                                    interaction.amountOut()
                            );
                            outcome.interaction(interaction);
                        }
                        outcome.fill(Fill.of(order, executedSell, executedBuy, FillSource.ROUTED));
                        log.debug("Routed order {}: sell={} buy={} hops={} attempt={}",
                                order.getId(), executedSell, executedBuy, route.hops(), attempt + 1);
                        routed = true;
                        break;
                    }
                }
                amount = order.cappedToken().floor(amount.divide(BigDecimal.valueOf(2), DecimalMath.MC));
            }
            if (!routed) {
                log.debug("No acceptable route for order {}", order.getId());
                outcome.unfilledOrderId(order.getId());
            }
        }
        return outcome.overlay(current).build();
    }

    /**
     * Builds the search query for {@code amount} on the order's capped side, carrying the
     * order's limit as a pruning bound.
     */
    static RouteQuery query(Order order, BigDecimal amount, int maxHops, boolean splitting) {
        BigDecimal limit = order.getKind() == OrderKind.SELL
                ? order.getBuyAmount().multiply(amount).divide(order.getSellAmount(), DecimalMath.MC)
                : order.getSellAmount().multiply(amount).divide(order.getBuyAmount(), DecimalMath.MC);
        return new RouteQuery(
                order.getSellToken(),
                order.getBuyToken(),
                order.getKind(),
                amount,
                limit,
                maxHops,
                splitting
        );
    }
}
