package org.Aayush.solver.graph;

import org.Aayush.solver.domain.Token;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.Aayush.solver.testutil.AuctionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class GraphPriceEstimatorTest {

    @Test
    @DisplayName("Propagation: unknown prices follow pool marginal rates from priced tokens")
    void testPropagatesFromKnownPrice() {
        LiquidityGraph graph = LiquidityGraphBuilder.build(List.of(A, B, C), List.of(
                constantProduct("ab", A, "100", B, "200", 0),
                constantProduct("bc", B, "100", C, "400", 0)
        ));

        Map<Token, BigDecimal> prices = GraphPriceEstimator.estimate(graph, Map.of(A, dec("10")));

        assertEquals(0, prices.get(A).compareTo(dec("10")));
        assertEquals(0, prices.get(B).compareTo(dec("5")));
        assertEquals(0, prices.get(C).compareTo(dec("1.25")));
    }

    @Test
    @DisplayName("Known prices are kept as-is even when pools disagree")
    void testKnownPricesWin() {
        LiquidityGraph graph = LiquidityGraphBuilder.build(List.of(A, B), List.of(
                constantProduct("ab", A, "100", B, "200", 0)
        ));

        Map<Token, BigDecimal> prices = GraphPriceEstimator.estimate(graph, Map.of(A, dec("1"), B, dec("7")));

        assertEquals(0, prices.get(B).compareTo(dec("7")));
    }

    @Test
    @DisplayName("Numeraire fallback: without known prices the first token is worth one")
    void testFallbackNumeraire() {
        LiquidityGraph graph = LiquidityGraphBuilder.build(List.of(A, B, D), List.of(
                constantProduct("ab", A, "100", B, "50", 0)
        ));

        Map<Token, BigDecimal> prices = GraphPriceEstimator.estimate(graph, Map.of());

        assertEquals(0, prices.get(A).compareTo(BigDecimal.ONE));
        assertEquals(0, prices.get(B).compareTo(dec("2")));
        assertFalse(prices.containsKey(D), "isolated token stays unpriced");
        assertEquals(List.of(A, B), List.copyOf(prices.keySet()));
    }
}
