package org.Aayush.solver.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One atomic exchange against one liquidity pool.
 *
 * @param poolId pool identifier.
 * @param tokenIn token paid into the pool by the settlement.
 * @param tokenOut token received from the pool by the settlement.
 * @param amountIn amount paid in.
 * @param amountOut amount received.
 */
public record Interaction(
        String poolId,
        Token tokenIn,
        Token tokenOut,
        BigDecimal amountIn,
        BigDecimal amountOut
) {
    public Interaction {
        Objects.requireNonNull(poolId, "poolId");
        Objects.requireNonNull(tokenIn, "tokenIn");
        Objects.requireNonNull(tokenOut, "tokenOut");
        Objects.requireNonNull(amountIn, "amountIn");
        Objects.requireNonNull(amountOut, "amountOut");
    }
}
