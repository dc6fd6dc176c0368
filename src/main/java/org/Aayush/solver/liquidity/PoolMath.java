package org.Aayush.solver.liquidity;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.util.List;

/**
 * Pricing dispatch for every {@link PoolKind}.
 *
 * <p>Rounding contract:</p>
 * <ul>
 * <li>{@link #quote} rounds outputs down to output-token decimals.</li>
 * <li>{@link #quoteInverse} rounds inputs up to input-token decimals and verifies the rounded
 * input really buys the requested output.</li>
 * <li>{@link #marginalPrice} is unrounded and includes the pool fee.</li>
 * </ul>
 * <p>A {@code null} result means the pool cannot serve the trade (unsupported pair, empty
 * reserve, output would drain the pool, output rounds to zero, or the curve math fails for
 * extreme reserves and amounts).</p>
 */
@Slf4j
public final class PoolMath {
    private static final int MAX_INVERSE_BUMPS = 4;
    private static final BigDecimal STABLE_PROBE_FRACTION = BigDecimal.ONE.movePointLeft(12);

    private PoolMath() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Quotes output amount for an exact input.
     */
    public static BigDecimal quote(LiquidityPool pool, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        if (!tradable(pool, tokenIn, tokenOut) || amountIn == null || amountIn.signum() <= 0) {
            return null;
        }
        BigDecimal raw;
        try {
            raw = rawOut(pool, tokenIn, tokenOut, amountIn);
        } catch (ArithmeticException ex) {
            logUnserved(pool, tokenIn, tokenOut, ex);
            return null;
        }
        if (raw == null) {
            return null;
        }
        BigDecimal out = tokenOut.floor(raw);
        if (out.signum() <= 0 || out.compareTo(pool.reserve(tokenOut)) >= 0) {
            return null;
        }
        return out;
    }

    /**
     * Quotes input amount for an exact output.
     */
    public static BigDecimal quoteInverse(LiquidityPool pool, Token tokenIn, Token tokenOut, BigDecimal amountOut) {
        if (!tradable(pool, tokenIn, tokenOut) || amountOut == null || amountOut.signum() <= 0) {
            return null;
        }
        if (amountOut.compareTo(pool.reserve(tokenOut)) >= 0) {
            return null;
        }
        BigDecimal raw;
        try {
            raw = rawIn(pool, tokenIn, tokenOut, amountOut);
        } catch (ArithmeticException ex) {
            logUnserved(pool, tokenIn, tokenOut, ex);
            return null;
        }
        if (raw == null || raw.signum() <= 0) {
            return null;
        }
        BigDecimal in = tokenIn.ceil(raw);
        for (int bump = 0; bump <= MAX_INVERSE_BUMPS; bump++) {
            BigDecimal forward = quote(pool, tokenIn, tokenOut, in);
            if (forward != null && forward.compareTo(amountOut) >= 0) {
                return in;
            }
            in = in.add(tokenIn.atom());
        }
        return null;
    }

    /**
     * Spot exchange rate (output units per input unit) including fee.
     *
     * @return marginal price, or null when the pool cannot trade the pair.
     */
    public static BigDecimal marginalPrice(LiquidityPool pool, Token tokenIn, Token tokenOut) {
        if (!tradable(pool, tokenIn, tokenOut)) {
            return null;
        }
        try {
            return spotPrice(pool, tokenIn, tokenOut);
        } catch (ArithmeticException ex) {
            logUnserved(pool, tokenIn, tokenOut, ex);
            return null;
        }
    }

    private static BigDecimal spotPrice(LiquidityPool pool, Token tokenIn, Token tokenOut) {
        BigDecimal rIn = pool.reserve(tokenIn);
        BigDecimal rOut = pool.reserve(tokenOut);
        return switch (pool.getKind()) {
            case CONSTANT_PRODUCT -> rOut.multiply(pool.feeMultiplier())
                    .divide(rIn, DecimalMath.MC);
            case WEIGHTED -> {
                BigDecimal wIn = pool.getWeights().get(tokenIn);
                BigDecimal wOut = pool.getWeights().get(tokenOut);
                yield rOut.multiply(wIn).multiply(pool.feeMultiplier())
                        .divide(rIn.multiply(wOut), DecimalMath.MC);
            }
            case STABLE_SWAP -> {
                BigDecimal probe = rIn.multiply(STABLE_PROBE_FRACTION);
                BigDecimal out = rawOut(pool, tokenIn, tokenOut, probe);
                yield out == null ? null : out.divide(probe, DecimalMath.MC);
            }
        };
    }

    private static void logUnserved(LiquidityPool pool, Token tokenIn, Token tokenOut, ArithmeticException ex) {
        log.debug("Pool {} cannot price {} -> {}: {}", pool.getId(), tokenIn, tokenOut, ex.getMessage());
    }

    private static boolean tradable(LiquidityPool pool, Token tokenIn, Token tokenOut) {
        return pool.supports(tokenIn, tokenOut)
                && pool.reserve(tokenIn).signum() > 0
                && pool.reserve(tokenOut).signum() > 0;
    }

    private static BigDecimal rawOut(LiquidityPool pool, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        BigDecimal rIn = pool.reserve(tokenIn);
        BigDecimal rOut = pool.reserve(tokenOut);
        BigDecimal gamma = pool.feeMultiplier();
        return switch (pool.getKind()) {
            case CONSTANT_PRODUCT -> {
                BigDecimal effectiveIn = amountIn.multiply(gamma);
                yield rOut.multiply(effectiveIn).divide(rIn.add(effectiveIn), DecimalMath.MC);
            }
            case WEIGHTED -> {
                BigDecimal exponent = pool.getWeights().get(tokenIn)
                        .divide(pool.getWeights().get(tokenOut), DecimalMath.MC);
                BigDecimal ratio = rIn.divide(rIn.add(amountIn.multiply(gamma)), DecimalMath.MC);
                BigDecimal remaining = DecimalMath.pow(ratio, exponent);
                yield rOut.multiply(BigDecimal.ONE.subtract(remaining), DecimalMath.MC);
            }
            case STABLE_SWAP -> StableSwapMath.outGivenIn(
                    balances(pool),
                    pool.getTokens().indexOf(tokenIn),
                    pool.getTokens().indexOf(tokenOut),
                    amountIn,
                    pool.getAmplification(),
                    gamma
            );
        };
    }

    private static BigDecimal rawIn(LiquidityPool pool, Token tokenIn, Token tokenOut, BigDecimal amountOut) {
        BigDecimal rIn = pool.reserve(tokenIn);
        BigDecimal rOut = pool.reserve(tokenOut);
        BigDecimal gamma = pool.feeMultiplier();
        return switch (pool.getKind()) {
            case CONSTANT_PRODUCT -> rIn.multiply(amountOut)
                    .divide(rOut.subtract(amountOut).multiply(gamma), DecimalMath.MC);
            case WEIGHTED -> {
                BigDecimal exponent = pool.getWeights().get(tokenOut)
                        .divide(pool.getWeights().get(tokenIn), DecimalMath.MC);
                BigDecimal ratio = rOut.divide(rOut.subtract(amountOut), DecimalMath.MC);
                BigDecimal growth = DecimalMath.pow(ratio, exponent).subtract(BigDecimal.ONE);
                yield rIn.multiply(growth).divide(gamma, DecimalMath.MC);
            }
            case STABLE_SWAP -> StableSwapMath.inGivenOut(
                    balances(pool),
                    pool.getTokens().indexOf(tokenIn),
                    pool.getTokens().indexOf(tokenOut),
                    amountOut,
                    pool.getAmplification(),
                    gamma
            );
        };
    }

    private static BigDecimal[] balances(LiquidityPool pool) {
        List<Token> tokens = pool.getTokens();
        BigDecimal[] balances = new BigDecimal[tokens.size()];
        for (int k = 0; k < balances.length; k++) {
            balances[k] = pool.reserve(tokens.get(k));
        }
        return balances;
    }
}
