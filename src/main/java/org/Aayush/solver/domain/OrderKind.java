package org.Aayush.solver.domain;

/**
 * Side of an order: which amount is the exact, capped quantity.
 */
public enum OrderKind {
    /** Sell exactly up to {@code sellAmount}; buy amount is a minimum. */
    SELL,
    /** Buy exactly up to {@code buyAmount}; sell amount is a maximum. */
    BUY
}
