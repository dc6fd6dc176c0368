package org.Aayush.solver.routing;

import org.Aayush.solver.domain.Interaction;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.liquidity.LiquidityPool;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * One hop of a route: an exchange of {@code tokenIn} for {@code tokenOut} through one pool or
 * split across several parallel pools.
 *
 * @param interactions per-pool exchanges; their inputs sum to {@code amountIn} and their
 *                     outputs to {@code amountOut}.
 */
public record RouteLeg(
        Token tokenIn,
        Token tokenOut,
        BigDecimal amountIn,
        BigDecimal amountOut,
        List<Interaction> interactions
) {
    public RouteLeg {
        Objects.requireNonNull(tokenIn, "tokenIn");
        Objects.requireNonNull(tokenOut, "tokenOut");
        Objects.requireNonNull(amountIn, "amountIn");
        Objects.requireNonNull(amountOut, "amountOut");
        interactions = List.copyOf(interactions);
        if (interactions.isEmpty()) {
            throw new IllegalArgumentException("route leg requires at least one interaction");
        }
    }

    /**
     * Single-pool hop.
     */
    public static RouteLeg single(LiquidityPool pool, Token tokenIn, Token tokenOut, BigDecimal amountIn, BigDecimal amountOut) {
        return new RouteLeg(tokenIn, tokenOut, amountIn, amountOut,
                List.of(new Interaction(pool.getId(), tokenIn, tokenOut, amountIn, amountOut)));
    }

    public boolean isSplit() {
        return interactions.size() > 1;
    }
}
