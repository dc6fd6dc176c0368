package org.Aayush.solver.liquidity;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable liquidity pool snapshot.
 *
 * <p>The pool is a tagged variant: {@link #getKind()} selects the pricing curve and only the
 * kind-specific fields it needs are populated ({@code weights} for {@link PoolKind#WEIGHTED},
 * {@code amplification} for {@link PoolKind#STABLE_SWAP}). Reserves are never mutated; simulated
 * consumption goes through {@link #withReserves(Map)} or a {@link ReserveOverlay}.</p>
 */
@Value
@Builder(toBuilder = true)
public class LiquidityPool {
    public static final int BPS_DENOMINATOR = 10_000;

    @NonNull
    String id;
    @NonNull
    PoolKind kind;
    @Singular
    List<Token> tokens;
    @Singular("reserve")
    Map<Token, BigDecimal> reserves;
    int feeBps;
    @Singular
    Map<Token, BigDecimal> weights;
    BigDecimal amplification;

    /**
     * Returns reserve of one token (zero when the pool does not hold the token).
     */
    public BigDecimal reserve(Token token) {
        BigDecimal reserve = reserves.get(token);
        return reserve == null ? BigDecimal.ZERO : reserve;
    }

    /**
     * Returns whether this pool can trade between two distinct tokens.
     */
    public boolean supports(Token tokenIn, Token tokenOut) {
        return !tokenIn.equals(tokenOut) && tokens.contains(tokenIn) && tokens.contains(tokenOut);
    }

    /**
     * Quotes the output of selling {@code amountIn} of {@code tokenIn}.
     *
     * @return output amount rounded down to {@code tokenOut} decimals, or null when the pool
     * cannot serve the trade.
     */
    public BigDecimal quote(Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        return PoolMath.quote(this, tokenIn, tokenOut, amountIn);
    }

    /**
     * Quotes the input required to receive exactly {@code amountOut} of {@code tokenOut}.
     *
     * @return input amount rounded up to {@code tokenIn} decimals, or null when the pool
     * cannot serve the trade.
     */
    public BigDecimal quoteInverse(Token tokenIn, Token tokenOut, BigDecimal amountOut) {
        return PoolMath.quoteInverse(this, tokenIn, tokenOut, amountOut);
    }

    /**
     * Returns a copy of this pool with replaced reserves.
     */
    public LiquidityPool withReserves(Map<Token, BigDecimal> newReserves) {
        return toBuilder().clearReserves().reserves(new LinkedHashMap<>(newReserves)).build();
    }

    /**
     * Returns a copy of this pool after one simulated swap.
     */
    public LiquidityPool afterSwap(Token tokenIn, Token tokenOut, BigDecimal amountIn, BigDecimal amountOut) {
        Map<Token, BigDecimal> next = new LinkedHashMap<>(reserves);
        next.put(tokenIn, reserve(tokenIn).add(amountIn));
        next.put(tokenOut, reserve(tokenOut).subtract(amountOut));
        return withReserves(next);
    }

    /**
     * Fee fraction as exact decimal ({@code feeBps / 10000}).
     */
    public BigDecimal feeFraction() {
        return BigDecimal.valueOf(feeBps).movePointLeft(4);
    }

    /**
     * Fee multiplier {@code 1 - fee} applied to inputs or outputs.
     */
    public BigDecimal feeMultiplier() {
        return BigDecimal.ONE.subtract(feeFraction());
    }
}
