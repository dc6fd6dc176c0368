package org.Aayush.solver.matching;

import org.Aayush.solver.domain.Order;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Unfilled remainder of one order.
 *
 * @param order original order; its limit price still applies to the remainder.
 * @param remaining remaining amount on the order's capped side (sell for SELL orders, buy for
 *                  BUY orders); always {@code > 0}.
 * @param touched whether an earlier fill already executed part of the order.
 */
public record Residual(Order order, BigDecimal remaining, boolean touched) {
    public Residual {
        Objects.requireNonNull(order, "order");
        Objects.requireNonNull(remaining, "remaining");
        if (remaining.signum() <= 0) {
            throw new IllegalArgumentException("remaining must be > 0 for order " + order.getId());
        }
    }

    /**
     * Residual of an untouched order.
     */
    public static Residual of(Order order) {
        return new Residual(order, order.cappedAmount(), false);
    }
}
