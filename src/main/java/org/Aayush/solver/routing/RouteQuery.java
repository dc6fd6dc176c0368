package org.Aayush.solver.routing;

import org.Aayush.solver.domain.OrderKind;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One route-search request.
 *
 * @param side SELL searches for the largest output of exactly {@code amount} sold; BUY searches
 *             for the smallest input buying exactly {@code amount}.
 * @param limitAmount optional bound a result must reach: minimum output for SELL, maximum input
 *                    for BUY. Paths that cannot reach it are pruned. May be null.
 * @param maxHops maximum number of legs.
 * @param splitting whether a hop may be split across parallel pools.
 */
public record RouteQuery(
        Token sellToken,
        Token buyToken,
        OrderKind side,
        BigDecimal amount,
        BigDecimal limitAmount,
        int maxHops,
        boolean splitting
) {
    public RouteQuery {
        Objects.requireNonNull(sellToken, "sellToken");
        Objects.requireNonNull(buyToken, "buyToken");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be > 0, got " + amount);
        }
        if (maxHops <= 0) {
            throw new IllegalArgumentException("maxHops must be > 0, got " + maxHops);
        }
    }
}
