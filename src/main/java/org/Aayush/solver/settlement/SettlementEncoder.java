package org.Aayush.solver.settlement;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.solver.domain.Fill;
import org.Aayush.solver.domain.Interaction;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.Solution;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.liquidity.DecimalMath;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges peer and routed fills into one {@link Solution}.
 *
 * <p>Interactions keep commit order. Clearing prices cover every traded token: reference prices
 * where known, otherwise the price implied by a fill against an already priced token, resolved
 * over fills in commit order until no further token can be priced.</p>
 *
 * <p>Before returning, the encoder asserts:</p>
 * <ul>
 * <li>every fill belongs to a known order, has positive amounts and respects the order's limit
 * price;</li>
 * <li>per order, the summed fills stay within the order's capped amount;</li>
 * <li>per token, amounts entering the settlement equal amounts leaving it, exactly.</li>
 * </ul>
 */
@Slf4j
public final class SettlementEncoder {

    /**
     * Encodes fills and interactions.
     *
     * @param auctionId auction identifier.
     * @param strategyId producing strategy.
     * @param orders orders by id.
     * @param fills peer fills followed by routed fills, in commit order.
     * @param interactions pool interactions in commit order.
     * @param referencePrices token values in the common numeraire.
     * @return unscored solution.
     * @throws InfeasibleSettlementException when an assertion fails.
     */
    public Solution encode(
            String auctionId,
            String strategyId,
            Map<String, Order> orders,
            List<Fill> fills,
            List<Interaction> interactions,
            Map<Token, BigDecimal> referencePrices
    ) {
        Objects.requireNonNull(orders, "orders");
        Objects.requireNonNull(fills, "fills");
        Objects.requireNonNull(interactions, "interactions");
        Objects.requireNonNull(referencePrices, "referencePrices");

        verifyFills(orders, fills);
        verifyConservation(fills, interactions);
        Map<Token, BigDecimal> clearingPrices = clearingPrices(fills, interactions, referencePrices);

        Solution solution = Solution.builder()
                .auctionId(auctionId)
                .strategyId(strategyId)
                .fills(fills)
                .interactions(interactions)
                .clearingPrices(clearingPrices)
                .build();
        log.debug("Encoded solution {}/{}: fills={}, interactions={}, prices={}",
                auctionId, strategyId, fills.size(), interactions.size(), clearingPrices.size());
        return solution;
    }

    private static void verifyFills(Map<String, Order> orders, List<Fill> fills) {
        Map<String, BigDecimal> cappedTotals = new HashMap<>();
        for (Fill fill : fills) {
            Order order = orders.get(fill.orderId());
            if (order == null) {
                throw new InfeasibleSettlementException(
                        InfeasibleSettlementException.REASON_UNKNOWN_ORDER,
                        "fill references unknown order " + fill.orderId()
                );
            }
            if (fill.executedSell().signum() <= 0 || fill.executedBuy().signum() <= 0) {
                throw new InfeasibleSettlementException(
                        InfeasibleSettlementException.REASON_NON_POSITIVE_AMOUNT,
                        "fill of order " + order.getId() + " has non-positive amounts"
                );
            }
            if (!order.respectsLimit(fill.executedSell(), fill.executedBuy())) {
                throw new InfeasibleSettlementException(
                        InfeasibleSettlementException.REASON_LIMIT_VIOLATED,
                        "fill of order " + order.getId() + " violates limit: sell=" + fill.executedSell()
                                + " buy=" + fill.executedBuy()
                );
            }
            BigDecimal capped = order.cappedToken().equals(fill.sellToken()) ? fill.executedSell() : fill.executedBuy();
            BigDecimal total = cappedTotals.merge(order.getId(), capped, BigDecimal::add);
            if (total.compareTo(order.cappedAmount()) > 0) {
                throw new InfeasibleSettlementException(
                        InfeasibleSettlementException.REASON_CAP_EXCEEDED,
                        "fills of order " + order.getId() + " exceed " + order.cappedAmount() + ": " + total
                );
            }
        }
    }

    private static void verifyConservation(List<Fill> fills, List<Interaction> interactions) {
        Map<Token, BigDecimal> net = new LinkedHashMap<>();
        for (Fill fill : fills) {
            net.merge(fill.sellToken(), fill.executedSell(), BigDecimal::add);
            net.merge(fill.buyToken(), fill.executedBuy().negate(), BigDecimal::add);
        }
        for (Interaction interaction : interactions) {
            net.merge(interaction.tokenOut(), interaction.amountOut(), BigDecimal::add);
            net.merge(interaction.tokenIn(), interaction.amountIn().negate(), BigDecimal::add);
        }
        for (Map.Entry<Token, BigDecimal> entry : net.entrySet()) {
            if (entry.getValue().signum() != 0) {
                throw new InfeasibleSettlementException(
                        InfeasibleSettlementException.REASON_CONSERVATION_VIOLATED,
                        "token " + entry.getKey() + " is not conserved: net " + entry.getValue()
                );
            }
        }
    }

    private static Map<Token, BigDecimal> clearingPrices(
            List<Fill> fills,
            List<Interaction> interactions,
            Map<Token, BigDecimal> referencePrices
    ) {
        Set<Token> traded = new LinkedHashSet<>();
        for (Fill fill : fills) {
            traded.add(fill.sellToken());
            traded.add(fill.buyToken());
        }
        for (Interaction interaction : interactions) {
            traded.add(interaction.tokenIn());
            traded.add(interaction.tokenOut());
        }

        Map<Token, BigDecimal> prices = new LinkedHashMap<>();
        for (Token token : traded) {
            BigDecimal reference = referencePrices.get(token);
            if (reference != null) {
                prices.put(token, reference);
            }
        }

        boolean progressed = true;
        while (progressed && prices.size() < traded.size()) {
            progressed = false;
            for (Fill fill : fills) {
                BigDecimal sellPrice = prices.get(fill.sellToken());
                BigDecimal buyPrice = prices.get(fill.buyToken());
                if (sellPrice != null && buyPrice == null) {
                    // executedSell · p(sell) = executedBuy · p(buy)
                    prices.put(fill.buyToken(), sellPrice.multiply(fill.executedSell())
                            .divide(fill.executedBuy(), DecimalMath.MC));
                    progressed = true;
                } else if (buyPrice != null && sellPrice == null) {
                    prices.put(fill.sellToken(), buyPrice.multiply(fill.executedBuy())
                            .divide(fill.executedSell(), DecimalMath.MC));
                    progressed = true;
                }
            }
        }
        return prices;
    }
}
