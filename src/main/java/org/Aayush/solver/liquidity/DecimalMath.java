package org.Aayush.solver.liquidity;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Arbitrary-precision decimal helpers used by pool curves.
 *
 * <p>All results are computed with {@link #WORKING} guard digits and returned in
 * {@link #MC}. Only {@code ln}, {@code exp} and real-valued {@code pow} are provided; everything
 * else uses {@link BigDecimal} directly.</p>
 */
public final class DecimalMath {
    /** Precision used for every intermediate pricing value. */
    public static final MathContext MC = new MathContext(50, RoundingMode.HALF_EVEN);

    private static final MathContext WORKING = new MathContext(64, RoundingMode.HALF_EVEN);
    private static final BigDecimal EXP_UNDERFLOW = BigDecimal.valueOf(-1_000);
    private static final BigDecimal EXP_OVERFLOW = BigDecimal.valueOf(1_000);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigDecimal SERIES_EPSILON = BigDecimal.ONE.movePointLeft(66);
    private static final int MAX_SERIES_TERMS = 2_000;
    private static final BigDecimal LN_2 = atanhSeries(BigDecimal.ONE.divide(BigDecimal.valueOf(3), WORKING))
            .multiply(TWO, WORKING);

    private DecimalMath() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Natural logarithm.
     *
     * @param x strictly positive argument.
     * @return {@code ln(x)} in {@link #MC}.
     */
    public static BigDecimal ln(BigDecimal x) {
        if (x.signum() <= 0) {
            throw new ArithmeticException("ln argument must be > 0, got " + x);
        }
        // Reduce into [0.5, 2] so the atanh series converges quickly.
        int powersOfTwo = 0;
        BigDecimal reduced = x;
        while (reduced.compareTo(TWO) > 0) {
            reduced = reduced.divide(TWO, WORKING);
            powersOfTwo++;
        }
        while (reduced.compareTo(HALF) < 0) {
            reduced = reduced.multiply(TWO, WORKING);
            powersOfTwo--;
        }
        BigDecimal z = reduced.subtract(BigDecimal.ONE).divide(reduced.add(BigDecimal.ONE), WORKING);
        BigDecimal lnReduced = atanhSeries(z).multiply(TWO, WORKING);
        return lnReduced.add(LN_2.multiply(BigDecimal.valueOf(powersOfTwo), WORKING), WORKING).round(MC);
    }

    /**
     * Exponential function.
     *
     * @param x argument; values below {@code -1000} underflow to zero, values above {@code 1000}
     *          are rejected.
     * @return {@code e^x} in {@link #MC}.
     */
    public static BigDecimal exp(BigDecimal x) {
        if (x.compareTo(EXP_UNDERFLOW) < 0) {
            return BigDecimal.ZERO;
        }
        if (x.compareTo(EXP_OVERFLOW) > 0) {
            throw new ArithmeticException("exp argument out of supported range: " + x);
        }
        int halvings = 0;
        BigDecimal reduced = x;
        while (reduced.abs().compareTo(HALF) > 0) {
            reduced = reduced.divide(TWO, WORKING);
            halvings++;
        }
        BigDecimal sum = BigDecimal.ONE;
        BigDecimal term = BigDecimal.ONE;
        for (int n = 1; n < MAX_SERIES_TERMS; n++) {
            term = term.multiply(reduced, WORKING).divide(BigDecimal.valueOf(n), WORKING);
            sum = sum.add(term, WORKING);
            if (term.abs().compareTo(SERIES_EPSILON) < 0) {
                break;
            }
        }
        for (int i = 0; i < halvings; i++) {
            sum = sum.multiply(sum, WORKING);
        }
        return sum.round(MC);
    }

    /**
     * Real-valued power {@code base^exponent}.
     *
     * <p>Small integral exponents use exact repeated multiplication; everything else goes
     * through {@code exp(exponent * ln(base))}.</p>
     */
    public static BigDecimal pow(BigDecimal base, BigDecimal exponent) {
        if (exponent.signum() == 0) {
            return BigDecimal.ONE;
        }
        if (base.signum() <= 0) {
            throw new ArithmeticException("pow base must be > 0, got " + base);
        }
        BigDecimal normalized = exponent.stripTrailingZeros();
        if (normalized.scale() <= 0 && normalized.abs().compareTo(BigDecimal.valueOf(64)) <= 0) {
            int n = normalized.intValueExact();
            return n > 0
                    ? base.pow(n, MC)
                    : BigDecimal.ONE.divide(base.pow(-n, WORKING), MC);
        }
        return exp(exponent.multiply(ln(base), WORKING));
    }

    /**
     * Returns whether two values agree within {@code relativeTolerance} of the larger magnitude.
     */
    static boolean converged(BigDecimal current, BigDecimal previous, BigDecimal relativeTolerance) {
        BigDecimal scale = current.abs().max(previous.abs());
        if (scale.signum() == 0) {
            return true;
        }
        return current.subtract(previous).abs().compareTo(scale.multiply(relativeTolerance)) <= 0;
    }

    private static BigDecimal atanhSeries(BigDecimal z) {
        BigDecimal zSquared = z.multiply(z, WORKING);
        BigDecimal power = z;
        BigDecimal sum = z;
        for (int k = 3; k < MAX_SERIES_TERMS; k += 2) {
            power = power.multiply(zSquared, WORKING);
            BigDecimal term = power.divide(BigDecimal.valueOf(k), WORKING);
            sum = sum.add(term, WORKING);
            if (term.abs().compareTo(SERIES_EPSILON) < 0) {
                break;
            }
        }
        return sum;
    }
}
