package org.Aayush.solver.liquidity;

import java.math.BigDecimal;

/**
 * Curve-style amplified invariant solved with Newton iteration.
 *
 * <p>Balances are passed as an array in pool token order; indices {@code i} and {@code j} name
 * the input and output coin. Returned values are unrounded ({@link DecimalMath#MC}).</p>
 */
final class StableSwapMath {
    static final int MAX_ITERATIONS = 255;

    private static final BigDecimal TOLERANCE = BigDecimal.ONE.movePointLeft(40);

    private StableSwapMath() {
    }

    /**
     * Computes invariant {@code D} for the given balances.
     */
    static BigDecimal computeD(BigDecimal[] balances, BigDecimal amplification) {
        int n = balances.length;
        BigDecimal coins = BigDecimal.valueOf(n);
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal balance : balances) {
            sum = sum.add(balance);
        }
        if (sum.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal ann = amplification.multiply(coins.pow(n));
        BigDecimal d = sum;
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            BigDecimal dP = d;
            for (BigDecimal balance : balances) {
                dP = dP.multiply(d).divide(balance.multiply(coins), DecimalMath.MC);
            }
            BigDecimal previous = d;
            BigDecimal numerator = ann.multiply(sum).add(dP.multiply(coins)).multiply(d);
            BigDecimal denominator = ann.subtract(BigDecimal.ONE).multiply(d)
                    .add(coins.add(BigDecimal.ONE).multiply(dP));
            d = numerator.divide(denominator, DecimalMath.MC);
            if (DecimalMath.converged(d, previous, TOLERANCE)) {
                return d;
            }
        }
        throw new ArithmeticException("stable invariant did not converge");
    }

    /**
     * Solves the balance of coin {@code j} after coin {@code i} is set to {@code newBalanceI}.
     */
    static BigDecimal solveBalance(
            int i,
            int j,
            BigDecimal newBalanceI,
            BigDecimal[] balances,
            BigDecimal amplification,
            BigDecimal d
    ) {
        int n = balances.length;
        BigDecimal coins = BigDecimal.valueOf(n);
        BigDecimal ann = amplification.multiply(coins.pow(n));
        BigDecimal c = d;
        BigDecimal partialSum = BigDecimal.ZERO;
        for (int k = 0; k < n; k++) {
            if (k == j) {
                continue;
            }
            BigDecimal balance = k == i ? newBalanceI : balances[k];
            partialSum = partialSum.add(balance);
            c = c.multiply(d).divide(balance.multiply(coins), DecimalMath.MC);
        }
        c = c.multiply(d).divide(ann.multiply(coins), DecimalMath.MC);
        BigDecimal b = partialSum.add(d.divide(ann, DecimalMath.MC));

        BigDecimal y = d;
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            BigDecimal previous = y;
            BigDecimal numerator = y.multiply(y).add(c);
            BigDecimal denominator = y.multiply(BigDecimal.valueOf(2)).add(b).subtract(d);
            y = numerator.divide(denominator, DecimalMath.MC);
            if (DecimalMath.converged(y, previous, TOLERANCE)) {
                return y;
            }
        }
        throw new ArithmeticException("stable balance did not converge");
    }

    /**
     * Raw output for selling {@code amountIn} of coin {@code i} for coin {@code j}, after fee.
     */
    static BigDecimal outGivenIn(
            BigDecimal[] balances,
            int i,
            int j,
            BigDecimal amountIn,
            BigDecimal amplification,
            BigDecimal feeMultiplier
    ) {
        BigDecimal d = computeD(balances, amplification);
        BigDecimal y = solveBalance(i, j, balances[i].add(amountIn), balances, amplification, d);
        BigDecimal grossOut = balances[j].subtract(y);
        return grossOut.multiply(feeMultiplier, DecimalMath.MC);
    }

    /**
     * Raw input of coin {@code i} required to receive {@code amountOut} of coin {@code j}, or
     * null when the pool cannot pay that much.
     */
    static BigDecimal inGivenOut(
            BigDecimal[] balances,
            int i,
            int j,
            BigDecimal amountOut,
            BigDecimal amplification,
            BigDecimal feeMultiplier
    ) {
        BigDecimal grossOut = amountOut.divide(feeMultiplier, DecimalMath.MC);
        BigDecimal newBalanceJ = balances[j].subtract(grossOut);
        if (newBalanceJ.signum() <= 0) {
            return null;
        }
        BigDecimal d = computeD(balances, amplification);
        BigDecimal x = solveBalance(j, i, newBalanceJ, balances, amplification, d);
        return x.subtract(balances[i]);
    }
}
