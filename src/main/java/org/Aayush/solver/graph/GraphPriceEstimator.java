package org.Aayush.solver.graph;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.liquidity.DecimalMath;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Derives token reference prices in a common numeraire from snapshot marginal prices.
 *
 * <p>Known prices seed a breadth-first traversal of the graph. A token reached over edge
 * {@code u -> v} with marginal price {@code m} ({@code v} per {@code u}) is valued at
 * {@code price(u) / m}. The first assignment wins; traversal order is node order of the seeds,
 * then CSR edge order, so the result is deterministic. Tokens unreachable from any seed stay
 * unpriced.</p>
 *
 * <p>When no price is known at all, the first token of the graph becomes the numeraire at
 * price {@code 1}.</p>
 */
public final class GraphPriceEstimator {

    private GraphPriceEstimator() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Completes {@code knownPrices} with graph-implied prices.
     *
     * @param graph snapshot graph.
     * @param knownPrices externally supplied prices (may be empty); always kept as-is.
     * @return prices for every token reachable from a priced token, in node order.
     */
    public static Map<Token, BigDecimal> estimate(LiquidityGraph graph, Map<Token, BigDecimal> knownPrices) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(knownPrices, "knownPrices");
        int nodeCount = graph.nodeCount();
        BigDecimal[] prices = new BigDecimal[nodeCount];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        for (int node = 0; node < nodeCount; node++) {
            BigDecimal known = knownPrices.get(graph.token(node));
            if (known != null && known.signum() > 0) {
                prices[node] = known;
                queue.enqueue(node);
            }
        }
        if (queue.isEmpty() && nodeCount > 0) {
            prices[0] = BigDecimal.ONE;
            queue.enqueue(0);
        }

        LiquidityGraph.EdgeIterator edges = graph.iterator();
        while (!queue.isEmpty()) {
            int node = queue.dequeueInt();
            edges.resetOutgoing(node);
            while (edges.hasNext()) {
                int edgeId = edges.next();
                int target = graph.getEdgeDestination(edgeId);
                if (prices[target] != null) {
                    continue;
                }
                BigDecimal rate = graph.getBaseWeight(edgeId);
                prices[target] = prices[node].divide(rate, DecimalMath.MC);
                queue.enqueue(target);
            }
        }

        Map<Token, BigDecimal> result = new LinkedHashMap<>();
        for (int node = 0; node < nodeCount; node++) {
            if (prices[node] != null) {
                result.put(graph.token(node), prices[node]);
            }
        }
        return result;
    }
}
