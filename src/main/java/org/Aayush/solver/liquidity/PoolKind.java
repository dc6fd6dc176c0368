package org.Aayush.solver.liquidity;

/**
 * Closed set of supported pool pricing curves.
 *
 * <p>Every pricing call site switches exhaustively over this enum; adding a kind means adding a
 * branch to {@link PoolMath}.</p>
 */
public enum PoolKind {
    /** Uniswap-v2 style {@code x * y = k}. */
    CONSTANT_PRODUCT,
    /** Balancer style weighted geometric mean invariant. */
    WEIGHTED,
    /** Curve style amplified stable invariant. */
    STABLE_SWAP
}
