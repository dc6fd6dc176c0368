package org.Aayush.solver.governor;

import org.Aayush.solver.domain.Auction;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.graph.LiquidityGraph;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Immutable inputs shared by all candidates of one run.
 *
 * @param auction validated auction.
 * @param graph snapshot liquidity graph.
 * @param orders prioritized orders in solving sequence.
 * @param ordersById every auction order by id.
 * @param referencePrices shared numeraire prices; identical for every candidate so scores compare.
 */
record SolveContext(
        Auction auction,
        LiquidityGraph graph,
        List<Order> orders,
        Map<String, Order> ordersById,
        Map<Token, BigDecimal> referencePrices
) {
    SolveContext {
        orders = List.copyOf(orders);
        ordersById = Map.copyOf(ordersById);
        referencePrices = Map.copyOf(referencePrices);
    }
}
