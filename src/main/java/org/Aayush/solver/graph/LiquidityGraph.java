package org.Aayush.solver.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.solver.core.id.TokenIndex;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.liquidity.LiquidityPool;
import org.Aayush.solver.liquidity.PoolMath;
import org.Aayush.solver.liquidity.ReserveOverlay;

import java.math.BigDecimal;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Immutable token graph of one auction snapshot.
 *
 * <p><b>Layout:</b> nodes are tokens with dense ids from a {@link TokenIndex}. Every
 * {@code (pool, direction)} pair is one directed edge; edges are stored in CSR form grouped by
 * origin node, so the outgoing edges of node {@code n} are the contiguous id range
 * {@code [outgoingStart(n), outgoingEnd(n))}. A second CSR index lists incoming edge ids per
 * node for backward traversal.</p>
 *
 * <p><b>Weights:</b> the base weight of an edge is the pool's marginal price (output per input,
 * fee included) in the snapshot. {@link #marginalPrice(int, ReserveOverlay)} re-evaluates the
 * edge against simulated consumption.</p>
 *
 * <p>Two pools serving the same ordered token pair produce parallel edges. Within one origin,
 * edges keep pool declaration order.</p>
 */
public final class LiquidityGraph {
    private final TokenIndex tokenIndex;
    private final List<LiquidityPool> pools;

    private final int[] firstEdge;
    private final int[] edgeOrigin;
    private final int[] edgeTarget;
    private final int[] edgePool;
    private final BigDecimal[] baseWeights;

    private final int[] firstIncoming;
    private final int[] incomingEdgeIds;

    LiquidityGraph(
            TokenIndex tokenIndex,
            List<LiquidityPool> pools,
            int[] firstEdge,
            int[] edgeOrigin,
            int[] edgeTarget,
            int[] edgePool,
            BigDecimal[] baseWeights
    ) {
        this.tokenIndex = Objects.requireNonNull(tokenIndex, "tokenIndex");
        this.pools = List.copyOf(pools);
        this.firstEdge = firstEdge;
        this.edgeOrigin = edgeOrigin;
        this.edgeTarget = edgeTarget;
        this.edgePool = edgePool;
        this.baseWeights = baseWeights;
        if (firstEdge.length != tokenIndex.size() + 1) {
            throw new IllegalArgumentException("firstEdge length must be nodeCount + 1");
        }

        int nodeCount = tokenIndex.size();
        int edgeCount = edgeTarget.length;
        int[] incomingDegree = new int[nodeCount];
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            incomingDegree[edgeTarget[edgeId]]++;
        }
        int[] first = new int[nodeCount + 1];
        int cursor = 0;
        for (int nodeId = 0; nodeId < nodeCount; nodeId++) {
            first[nodeId] = cursor;
            cursor += incomingDegree[nodeId];
        }
        first[nodeCount] = edgeCount;
        int[] fillCursor = first.clone();
        int[] incoming = new int[edgeCount];
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            incoming[fillCursor[edgeTarget[edgeId]]++] = edgeId;
        }
        this.firstIncoming = first;
        this.incomingEdgeIds = incoming;
    }

    public int nodeCount() {
        return tokenIndex.size();
    }

    public int edgeCount() {
        return edgeTarget.length;
    }

    public TokenIndex tokenIndex() {
        return tokenIndex;
    }

    public List<LiquidityPool> pools() {
        return pools;
    }

    public Token token(int nodeId) {
        return tokenIndex.toToken(nodeId);
    }

    /**
     * Returns node id of a token, or -1 when the token is not part of the graph.
     */
    public int nodeOf(Token token) {
        return tokenIndex.contains(token) ? tokenIndex.toNode(token) : -1;
    }

    public int getEdgeOrigin(int edgeId) {
        return edgeOrigin[edgeId];
    }

    public int getEdgeDestination(int edgeId) {
        return edgeTarget[edgeId];
    }

    public LiquidityPool getEdgePool(int edgeId) {
        return pools.get(edgePool[edgeId]);
    }

    /**
     * Snapshot marginal price of one edge.
     */
    public BigDecimal getBaseWeight(int edgeId) {
        return baseWeights[edgeId];
    }

    public Token edgeTokenIn(int edgeId) {
        return tokenIndex.toToken(edgeOrigin[edgeId]);
    }

    public Token edgeTokenOut(int edgeId) {
        return tokenIndex.toToken(edgeTarget[edgeId]);
    }

    /**
     * Marginal price of an edge under simulated consumption.
     *
     * @return output per input including fee, or null when the pool can no longer trade.
     */
    public BigDecimal marginalPrice(int edgeId, ReserveOverlay overlay) {
        Objects.requireNonNull(overlay, "overlay");
        LiquidityPool base = getEdgePool(edgeId);
        if (!overlay.touches(base.getId())) {
            return baseWeights[edgeId];
        }
        return PoolMath.marginalPrice(overlay.resolve(base), edgeTokenIn(edgeId), edgeTokenOut(edgeId));
    }

    public int outgoingStart(int nodeId) {
        validateNode(nodeId);
        return firstEdge[nodeId];
    }

    public int outgoingEnd(int nodeId) {
        validateNode(nodeId);
        return firstEdge[nodeId + 1];
    }

    public int incomingStart(int nodeId) {
        validateNode(nodeId);
        return firstIncoming[nodeId];
    }

    public int incomingEnd(int nodeId) {
        validateNode(nodeId);
        return firstIncoming[nodeId + 1];
    }

    /**
     * Returns incoming edge id at one reverse-array position.
     */
    public int incomingEdgeAt(int position) {
        return incomingEdgeIds[position];
    }

    /**
     * Returns all edges from {@code originNode} to {@code targetNode} in pool declaration order.
     */
    public IntList edgesBetween(int originNode, int targetNode) {
        IntList result = new IntArrayList();
        for (int edgeId = outgoingStart(originNode); edgeId < outgoingEnd(originNode); edgeId++) {
            if (edgeTarget[edgeId] == targetNode) {
                result.add(edgeId);
            }
        }
        return result;
    }

    /**
     * Returns edges parallel to {@code edgeId}, the edge itself included.
     */
    public IntList parallelEdges(int edgeId) {
        return edgesBetween(edgeOrigin[edgeId], edgeTarget[edgeId]);
    }

    public EdgeIterator iterator() {
        return new EdgeIterator(this);
    }

    private void validateNode(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount()) {
            throw new IndexOutOfBoundsException("nodeId out of bounds: " + nodeId);
        }
    }

    @Override
    public String toString() {
        return String.format("LiquidityGraph[tokens=%d, pools=%d, edges=%d]",
                nodeCount(), pools.size(), edgeCount());
    }

    /**
     * Reusable iterator over outgoing or incoming edge ids of one node.
     */
    public static final class EdgeIterator {
        private final LiquidityGraph graph;
        private boolean incoming;
        private int current;
        private int end;

        private EdgeIterator(LiquidityGraph graph) {
            this.graph = graph;
        }

        public EdgeIterator resetOutgoing(int nodeId) {
            this.incoming = false;
            this.current = graph.outgoingStart(nodeId);
            this.end = graph.outgoingEnd(nodeId);
            return this;
        }

        public EdgeIterator resetIncoming(int nodeId) {
            this.incoming = true;
            this.current = graph.incomingStart(nodeId);
            this.end = graph.incomingEnd(nodeId);
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        public int next() {
            if (current >= end) throw new NoSuchElementException();
            int position = current++;
            return incoming ? graph.incomingEdgeIds[position] : position;
        }
    }
}
