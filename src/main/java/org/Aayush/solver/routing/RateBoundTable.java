package org.Aayush.solver.routing;

import org.Aayush.solver.graph.LiquidityGraph;
import org.Aayush.solver.liquidity.DecimalMath;
import org.Aayush.solver.liquidity.ReserveOverlay;

import java.math.BigDecimal;

/**
 * Hop-limited best marginal-rate products toward (or from) one anchor node.
 *
 * <p>Entry {@code bound(node, h)} is the largest product of edge marginal prices over any walk
 * of at most {@code h} edges between {@code node} and the anchor, or null when no such walk
 * exists. Every supported pool curve is concave, so an amount moved along any path realizes at
 * most {@code amount × bound}; the table is an admissible optimistic estimate for route search.</p>
 *
 * <p>Rates are read under the supplied overlay, so a table is only valid for the consumption
 * state it was built from.</p>
 */
final class RateBoundTable {
    // [hops][node]
    private final BigDecimal[][] bounds;

    private RateBoundTable(BigDecimal[][] bounds) {
        this.bounds = bounds;
    }

    /**
     * Bounds on output per unit when walking from any node to {@code target}.
     */
    static RateBoundTable towards(LiquidityGraph graph, ReserveOverlay overlay, int target, int maxHops) {
        return build(graph, overlay, target, maxHops, true);
    }

    /**
     * Bounds on output per unit when walking from {@code source} to any node.
     */
    static RateBoundTable from(LiquidityGraph graph, ReserveOverlay overlay, int source, int maxHops) {
        return build(graph, overlay, source, maxHops, false);
    }

    /**
     * Returns the bound for {@code node} within {@code hops} edges, or null when unreachable.
     */
    BigDecimal bound(int node, int hops) {
        int h = Math.max(0, Math.min(hops, bounds.length - 1));
        return bounds[h][node];
    }

    int maxHops() {
        return bounds.length - 1;
    }

    private static RateBoundTable build(LiquidityGraph graph, ReserveOverlay overlay, int anchor, int maxHops, boolean towardsAnchor) {
        int nodeCount = graph.nodeCount();
        int edgeCount = graph.edgeCount();
        BigDecimal[] rates = new BigDecimal[edgeCount];
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            BigDecimal rate = graph.marginalPrice(edgeId, overlay);
            rates[edgeId] = rate != null && rate.signum() > 0 ? rate : null;
        }

        BigDecimal[][] bounds = new BigDecimal[maxHops + 1][nodeCount];
        bounds[0][anchor] = BigDecimal.ONE;
        for (int h = 1; h <= maxHops; h++) {
            BigDecimal[] previous = bounds[h - 1];
            BigDecimal[] current = previous.clone();
            for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
                if (rates[edgeId] == null) {
                    continue;
                }
                // towards: origin inherits from destination; from: destination inherits from origin
                int known = towardsAnchor ? graph.getEdgeDestination(edgeId) : graph.getEdgeOrigin(edgeId);
                int updated = towardsAnchor ? graph.getEdgeOrigin(edgeId) : graph.getEdgeDestination(edgeId);
                if (previous[known] == null) {
                    continue;
                }
                BigDecimal candidate = previous[known].multiply(rates[edgeId], DecimalMath.MC);
                if (current[updated] == null || candidate.compareTo(current[updated]) > 0) {
                    current[updated] = candidate;
                }
            }
            bounds[h] = current;
        }
        return new RateBoundTable(bounds);
    }
}
