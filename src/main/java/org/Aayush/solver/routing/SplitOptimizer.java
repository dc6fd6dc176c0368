package org.Aayush.solver.routing;

import org.Aayush.solver.domain.Interaction;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.liquidity.DecimalMath;
import org.Aayush.solver.liquidity.LiquidityPool;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Splits one hop across parallel pools by greedy chunk allocation.
 *
 * <p>The traded amount is cut into {@code chunks} equal parts (token-decimal aligned, last part
 * takes the remainder). Each part goes to the pool with the best incremental exchange at its
 * current allocation, which drives marginal rates of the used pools toward each other. Pool
 * amounts are quoted on their total allocation, so per-pool rounding happens once.</p>
 *
 * <p>Ties go to the pool declared first.</p>
 */
public final class SplitOptimizer {
    private final int chunks;

    public SplitOptimizer(int chunks) {
        if (chunks <= 0) {
            throw new IllegalArgumentException("chunks must be > 0, got " + chunks);
        }
        this.chunks = chunks;
    }

    public int chunks() {
        return chunks;
    }

    /**
     * Splits an exact input across pools maximizing total output.
     *
     * @param pools candidate pools under the current overlay, in declaration order.
     * @return split leg, or null when some part cannot be placed in any pool.
     */
    public RouteLeg splitSell(List<LiquidityPool> pools, Token tokenIn, Token tokenOut, BigDecimal amountIn) {
        Objects.requireNonNull(pools, "pools");
        int n = pools.size();
        BigDecimal[] allocated = zeros(n);
        BigDecimal[] produced = zeros(n);
        BigDecimal chunk = chunkSize(tokenIn, amountIn);

        BigDecimal remaining = amountIn;
        while (remaining.signum() > 0) {
            BigDecimal part = remaining.min(chunk);
            int bestIndex = -1;
            BigDecimal bestGain = null;
            BigDecimal bestOutput = null;
            for (int i = 0; i < n; i++) {
                BigDecimal output = pools.get(i).quote(tokenIn, tokenOut, allocated[i].add(part));
                if (output == null) {
                    continue;
                }
                BigDecimal gain = output.subtract(produced[i]);
                if (bestGain == null || gain.compareTo(bestGain) > 0) {
                    bestIndex = i;
                    bestGain = gain;
                    bestOutput = output;
                }
            }
            if (bestIndex < 0) {
                return null;
            }
            allocated[bestIndex] = allocated[bestIndex].add(part);
            produced[bestIndex] = bestOutput;
            remaining = remaining.subtract(part);
        }
        return toLeg(pools, tokenIn, tokenOut, allocated, produced);
    }

    /**
     * Splits an exact output across pools minimizing total input.
     *
     * @param pools candidate pools under the current overlay, in declaration order.
     * @return split leg, or null when some part cannot be placed in any pool.
     */
    public RouteLeg splitBuy(List<LiquidityPool> pools, Token tokenIn, Token tokenOut, BigDecimal amountOut) {
        Objects.requireNonNull(pools, "pools");
        int n = pools.size();
        BigDecimal[] required = zeros(n);
        BigDecimal[] allocated = zeros(n);
        BigDecimal chunk = chunkSize(tokenOut, amountOut);

        BigDecimal remaining = amountOut;
        while (remaining.signum() > 0) {
            BigDecimal part = remaining.min(chunk);
            int bestIndex = -1;
            BigDecimal bestCost = null;
            BigDecimal bestInput = null;
            for (int i = 0; i < n; i++) {
                BigDecimal input = pools.get(i).quoteInverse(tokenIn, tokenOut, allocated[i].add(part));
                if (input == null) {
                    continue;
                }
                BigDecimal cost = input.subtract(required[i]);
                if (bestCost == null || cost.compareTo(bestCost) < 0) {
                    bestIndex = i;
                    bestCost = cost;
                    bestInput = input;
                }
            }
            if (bestIndex < 0) {
                return null;
            }
            allocated[bestIndex] = allocated[bestIndex].add(part);
            required[bestIndex] = bestInput;
            remaining = remaining.subtract(part);
        }
        return toLeg(pools, tokenIn, tokenOut, required, allocated);
    }

    private BigDecimal chunkSize(Token token, BigDecimal amount) {
        BigDecimal chunk = token.floor(amount.divide(BigDecimal.valueOf(chunks), DecimalMath.MC));
        return chunk.signum() > 0 ? chunk : amount;
    }

    private static RouteLeg toLeg(List<LiquidityPool> pools, Token tokenIn, Token tokenOut, BigDecimal[] inputs, BigDecimal[] outputs) {
        List<Interaction> interactions = new ArrayList<>();
        BigDecimal totalIn = BigDecimal.ZERO;
        BigDecimal totalOut = BigDecimal.ZERO;
        for (int i = 0; i < pools.size(); i++) {
            if (inputs[i].signum() == 0) {
                continue;
            }
            interactions.add(new Interaction(pools.get(i).getId(), tokenIn, tokenOut, inputs[i], outputs[i]));
            totalIn = totalIn.add(inputs[i]);
            totalOut = totalOut.add(outputs[i]);
        }
        return new RouteLeg(tokenIn, tokenOut, totalIn, totalOut, interactions);
    }

    private static BigDecimal[] zeros(int n) {
        BigDecimal[] values = new BigDecimal[n];
        Arrays.fill(values, BigDecimal.ZERO);
        return values;
    }
}
