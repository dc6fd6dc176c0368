package org.Aayush.solver.routing;

import org.Aayush.solver.domain.Fill;
import org.Aayush.solver.domain.FillSource;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.OrderKind;
import org.Aayush.solver.graph.LiquidityGraph;
import org.Aayush.solver.graph.LiquidityGraphBuilder;
import org.Aayush.solver.liquidity.ReserveOverlay;
import org.Aayush.solver.matching.Residual;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.Aayush.solver.testutil.AuctionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class OrderRouterTest {
    private final OrderRouter router = new OrderRouter(
            new RouteSearch(SearchBudget.unbounded(), new SplitOptimizer(8)), 4);
    private LiquidityGraph graph;

    @BeforeEach
    void setUp() {
        graph = LiquidityGraphBuilder.build(auction("r", List.of(), chainPools()));
    }

    private RoutingOutcome route(int maxHops, Order... orders) {
        List<Residual> residuals = Arrays.stream(orders).map(Residual::of).toList();
        return router.route(graph, ReserveOverlay.empty(), residuals, maxHops, false, CancellationSignal.none());
    }

    @Test
    @DisplayName("Sequential consumption: the second identical order sees reserves left by the first")
    void testSequentialConsumption() {
        RoutingOutcome outcome = route(1,
                sell("o1", A, "100", B, "1", false),
                sell("o2", A, "100", B, "1", false));

        assertEquals(2, outcome.getFills().size());
        Fill first = outcome.getFills().get(0);
        Fill second = outcome.getFills().get(1);
        assertEquals(FillSource.ROUTED, first.source());
        assertEquals(0, first.executedSell().compareTo(dec("100")));
        assertTrue(second.executedBuy().compareTo(first.executedBuy()) < 0);
        assertEquals(2, outcome.getInteractions().size());
        assertEquals(0, outcome.getOverlay().delta("ab", A).compareTo(dec("200")));
        assertTrue(outcome.getUnfilledOrderIds().isEmpty());
    }

    @Test
    @DisplayName("Fill-or-kill: unreachable limit leaves the order unfilled and reserves untouched")
    void testFillOrKillUnfilled() {
        RoutingOutcome outcome = route(1, sell("o", A, "100", B, "95", false));

        assertTrue(outcome.getFills().isEmpty());
        assertEquals(List.of("o"), outcome.getUnfilledOrderIds());
        assertEquals(0, outcome.getOverlay().touchedPoolCount());
    }

    @Test
    @DisplayName("Partial fill: amount is halved until the limit becomes reachable")
    void testPartialHalving() {
        Order order = sell("o", A, "100", B, "95", true);

        RoutingOutcome outcome = route(1, order);

        assertEquals(1, outcome.getFills().size());
        Fill fill = outcome.getFills().get(0);
        assertEquals(0, fill.executedSell().compareTo(dec("25")));
        assertTrue(order.respectsLimit(fill.executedSell(), fill.executedBuy()));
    }

    @Test
    @DisplayName("Buy order: exact buy amount, paid input within the limit")
    void testBuyOrder() {
        Order order = buy("o", A, "1", D, "0.4", false);

        RoutingOutcome outcome = route(3, order);

        Fill fill = outcome.getFills().get(0);
        assertEquals(0, fill.executedBuy().compareTo(dec("0.4")));
        assertTrue(fill.executedSell().compareTo(dec("1")) <= 0);
        assertTrue(order.respectsLimit(fill.executedSell(), fill.executedBuy()));
        assertEquals(3, outcome.getInteractions().size());
    }

    @Test
    @DisplayName("Query: limit amount is the order's limit scaled to the routed amount")
    void testQueryLimit() {
        RouteQuery sellQuery = OrderRouter.query(sell("s", A, "10", B, "20", true), dec("5"), 2, true);
        RouteQuery buyQuery = OrderRouter.query(buy("b", A, "10", B, "20", true), dec("5"), 2, false);

        assertEquals(OrderKind.SELL, sellQuery.side());
        assertEquals(0, sellQuery.limitAmount().compareTo(dec("10")));
        assertEquals(OrderKind.BUY, buyQuery.side());
        assertEquals(0, buyQuery.limitAmount().compareTo(dec("2.5")));
        assertThrows(IllegalArgumentException.class,
                () -> new OrderRouter(new RouteSearch(SearchBudget.unbounded(), new SplitOptimizer(1)), 0));
    }
}
