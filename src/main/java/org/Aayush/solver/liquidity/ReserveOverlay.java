package org.Aayush.solver.liquidity;

import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Copy-on-write view of simulated reserve consumption, keyed by pool id.
 * <p>
 * The overlay stores signed reserve deltas on top of the immutable snapshot pools. Every
 * {@link #commit} returns a new overlay and leaves the receiver untouched, so two candidate
 * strategies starting from {@link #empty()} can never observe each other's simulation.
 * </p>
 * <p>
 * Delta contract:
 * </p>
 * <ul>
 * <li>Positive delta: tokens paid into the pool by earlier routes.</li>
 * <li>Negative delta: tokens taken out of the pool by earlier routes.</li>
 * <li>Missing pool id: the snapshot reserves apply unchanged.</li>
 * </ul>
 */
public final class ReserveOverlay {
    private static final ReserveOverlay EMPTY = new ReserveOverlay(Map.of());

    private final Map<String, Map<Token, BigDecimal>> deltasByPool;
    private final ConcurrentMap<String, LiquidityPool> resolved = new ConcurrentHashMap<>();

    private ReserveOverlay(Map<String, Map<Token, BigDecimal>> deltasByPool) {
        this.deltasByPool = deltasByPool;
    }

    /**
     * Returns the overlay with no simulated consumption.
     */
    public static ReserveOverlay empty() {
        return EMPTY;
    }

    /**
     * Resolves the effective pool state under this overlay.
     *
     * @param base snapshot pool.
     * @return {@code base} itself when untouched, otherwise a pool with adjusted reserves.
     */
    public LiquidityPool resolve(LiquidityPool base) {
        Objects.requireNonNull(base, "base");
        Map<Token, BigDecimal> deltas = deltasByPool.get(base.getId());
        if (deltas == null) {
            return base;
        }
        return resolved.computeIfAbsent(base.getId(), id -> applyDeltas(base, deltas));
    }

    /**
     * Records one swap against a pool and returns the resulting overlay.
     *
     * @param poolId pool identifier.
     * @param tokenIn token paid into the pool.
     * @param amountIn amount paid in; must be {@code > 0}.
     * @param tokenOut token taken out of the pool.
     * @param amountOut amount taken out; must be {@code > 0}.
     * @return new overlay including this swap.
     */
    public ReserveOverlay commit(String poolId, Token tokenIn, BigDecimal amountIn, Token tokenOut, BigDecimal amountOut) {
        Objects.requireNonNull(poolId, "poolId");
        if (amountIn.signum() <= 0 || amountOut.signum() <= 0) {
            throw new IllegalArgumentException("swap amounts must be > 0");
        }
        Map<String, Map<Token, BigDecimal>> next = new HashMap<>(deltasByPool);
        Map<Token, BigDecimal> poolDeltas = new LinkedHashMap<>(next.getOrDefault(poolId, Map.of()));
        poolDeltas.merge(tokenIn, amountIn, BigDecimal::add);
        poolDeltas.merge(tokenOut, amountOut.negate(), BigDecimal::add);
        next.put(poolId, Map.copyOf(poolDeltas));
        return new ReserveOverlay(Map.copyOf(next));
    }

    /**
     * Returns the accumulated reserve delta of one token in one pool.
     */
    public BigDecimal delta(String poolId, Token token) {
        Map<Token, BigDecimal> deltas = deltasByPool.get(poolId);
        if (deltas == null) {
            return BigDecimal.ZERO;
        }
        return deltas.getOrDefault(token, BigDecimal.ZERO);
    }

    /**
     * Returns whether any swap has been recorded against the pool.
     */
    public boolean touches(String poolId) {
        return deltasByPool.containsKey(poolId);
    }

    /**
     * Number of pools with recorded consumption.
     */
    public int touchedPoolCount() {
        return deltasByPool.size();
    }

    private static LiquidityPool applyDeltas(LiquidityPool base, Map<Token, BigDecimal> deltas) {
        Map<Token, BigDecimal> reserves = new LinkedHashMap<>(base.getReserves());
        for (Map.Entry<Token, BigDecimal> delta : deltas.entrySet()) {
            reserves.merge(delta.getKey(), delta.getValue(), BigDecimal::add);
        }
        return base.withReserves(reserves);
    }
}
