package org.Aayush.solver.graph;

import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.solver.core.id.TokenIndex;
import org.Aayush.solver.liquidity.LiquidityPool;
import org.Aayush.solver.liquidity.ReserveOverlay;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.Aayush.solver.testutil.AuctionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class LiquidityGraphTest {
    private LiquidityGraph graph;

    @BeforeEach
    void setUp() {
        graph = LiquidityGraphBuilder.build(auction("g", List.of(), chainPools()));
    }

    private List<Integer> outgoing(int node) {
        List<Integer> edges = new ArrayList<>();
        LiquidityGraph.EdgeIterator it = graph.iterator().resetOutgoing(node);
        while (it.hasNext()) {
            edges.add(it.next());
        }
        return edges;
    }

    @Test
    @DisplayName("Topology: one directed edge per ordered token pair per pool")
    void testTopology() {
        assertEquals(4, graph.nodeCount());
        assertEquals(8, graph.edgeCount());
        assertEquals(List.of(0, 1), outgoing(graph.nodeOf(A)));
        assertEquals(1, outgoing(graph.nodeOf(D)).size());
        assertEquals("LiquidityGraph[tokens=4, pools=4, edges=8]", graph.toString());
    }

    @Test
    @DisplayName("Edges: origin, destination, pool and tokens are consistent")
    void testEdgeAccessors() {
        int a = graph.nodeOf(A);
        for (int edgeId : outgoing(a)) {
            assertEquals(a, graph.getEdgeOrigin(edgeId));
            assertEquals(A, graph.edgeTokenIn(edgeId));
            LiquidityPool pool = graph.getEdgePool(edgeId);
            assertTrue(pool.supports(A, graph.edgeTokenOut(edgeId)));
            assertEquals(graph.token(graph.getEdgeDestination(edgeId)), graph.edgeTokenOut(edgeId));
        }
        assertEquals("ab", graph.getEdgePool(0).getId());
        assertEquals("ac-shallow", graph.getEdgePool(1).getId());
    }

    @Test
    @DisplayName("Reverse index: incoming edges of C come from A, B and D")
    void testIncomingEdges() {
        int c = graph.nodeOf(C);
        List<Integer> origins = new ArrayList<>();
        LiquidityGraph.EdgeIterator it = graph.iterator().resetIncoming(c);
        while (it.hasNext()) {
            int edgeId = it.next();
            assertEquals(c, graph.getEdgeDestination(edgeId));
            origins.add(graph.getEdgeOrigin(edgeId));
        }
        assertEquals(3, origins.size());
        assertTrue(origins.containsAll(List.of(graph.nodeOf(A), graph.nodeOf(B), graph.nodeOf(D))));
        assertEquals(3, graph.incomingEnd(c) - graph.incomingStart(c));
    }

    @Test
    @DisplayName("Base weight is the fee-adjusted marginal price until the pool is consumed")
    void testMarginalPriceUnderOverlay() {
        int ab = graph.edgesBetween(graph.nodeOf(A), graph.nodeOf(B)).getInt(0);
        assertEquals(0, graph.getBaseWeight(ab).compareTo(dec("0.997")));
        assertSame(graph.getBaseWeight(ab), graph.marginalPrice(ab, ReserveOverlay.empty()));

        ReserveOverlay overlay = ReserveOverlay.empty().commit("ab", A, dec("100"), B, dec("90"));
        assertTrue(graph.marginalPrice(ab, overlay).compareTo(graph.getBaseWeight(ab)) < 0);
    }

    @Test
    @DisplayName("Parallel pools: edgesBetween lists every pool for the pair in declaration order")
    void testParallelEdges() {
        LiquidityGraph parallel = LiquidityGraphBuilder.build(List.of(A, B), List.of(
                constantProduct("p1", A, "100", B, "100", 30),
                constantProduct("p2", A, "200", B, "200", 5)
        ));
        IntList edges = parallel.edgesBetween(parallel.nodeOf(A), parallel.nodeOf(B));

        assertEquals(2, edges.size());
        assertEquals("p1", parallel.getEdgePool(edges.getInt(0)).getId());
        assertEquals("p2", parallel.getEdgePool(edges.getInt(1)).getId());
        assertEquals(edges, parallel.parallelEdges(edges.getInt(1)));
    }

    @Test
    @DisplayName("Unknown tokens: absent node is -1 and pools with foreign tokens fail the build")
    void testUnknownTokens() {
        LiquidityGraph small = LiquidityGraphBuilder.build(List.of(A, B), List.of());

        assertEquals(-1, small.nodeOf(C));
        assertEquals(0, small.edgeCount());
        assertThrows(TokenIndex.UnknownTokenException.class, () -> LiquidityGraphBuilder.build(
                List.of(A), List.of(constantProduct("p", A, "1", B, "1", 0))));
        assertThrows(IndexOutOfBoundsException.class, () -> small.outgoingStart(5));
    }
}
