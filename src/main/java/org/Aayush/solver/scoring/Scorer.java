package org.Aayush.solver.scoring;

import org.Aayush.solver.domain.Fill;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.OrderKind;
import org.Aayush.solver.domain.Solution;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.liquidity.DecimalMath;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * Objective value of a solution.
 *
 * <p>{@code score = Σ surplus(fill) · price(surplusToken) − interactionPenalty · |interactions|},
 * with prices taken from the solution's clearing prices. A surplus in an unpriced token counts
 * as zero. A solution without fills scores exactly zero.</p>
 */
public final class Scorer {
    /**
     * Highest score first.
     */
    public static final Comparator<Solution> BY_SCORE_DESC =
            Comparator.comparing(Solution::getScore, Comparator.reverseOrder());

    private final BigDecimal interactionPenalty;

    /**
     * @param interactionPenalty numeraire cost charged per interaction; must be {@code >= 0}.
     */
    public Scorer(BigDecimal interactionPenalty) {
        Objects.requireNonNull(interactionPenalty, "interactionPenalty");
        if (interactionPenalty.signum() < 0) {
            throw new IllegalArgumentException("interactionPenalty must be >= 0, got " + interactionPenalty);
        }
        this.interactionPenalty = interactionPenalty;
    }

    public BigDecimal interactionPenalty() {
        return interactionPenalty;
    }

    /**
     * Computes the objective value of {@code solution}.
     *
     * @param orders orders by id; every fill must reference one of them.
     */
    public BigDecimal score(Solution solution, Map<String, Order> orders) {
        Objects.requireNonNull(solution, "solution");
        Objects.requireNonNull(orders, "orders");
        if (solution.isEmpty()) {
            return BigDecimal.ZERO;
        }
        Map<Token, BigDecimal> prices = solution.getClearingPrices();
        BigDecimal total = BigDecimal.ZERO;
        for (Fill fill : solution.getFills()) {
            Order order = orders.get(fill.orderId());
            if (order == null) {
                throw new IllegalArgumentException("fill references unknown order " + fill.orderId());
            }
            BigDecimal price = prices.get(surplusToken(order));
            if (price == null) {
                continue;
            }
            total = total.add(surplus(order, fill).multiply(price, DecimalMath.MC));
        }
        BigDecimal penalty = interactionPenalty.multiply(BigDecimal.valueOf(solution.getInteractions().size()));
        return total.subtract(penalty);
    }

    /**
     * Returns {@code solution} with its score set.
     */
    public Solution scored(Solution solution, Map<String, Order> orders) {
        return solution.withScore(score(solution, orders));
    }

    /**
     * Surplus of one fill over the order's limit price, in {@link #surplusToken(Order)} units.
     *
     * <p>SELL: {@code executedBuy − buyAmount·executedSell/sellAmount} (buy token).
     * BUY: {@code sellAmount·executedBuy/buyAmount − executedSell} (sell token).</p>
     */
    public static BigDecimal surplus(Order order, Fill fill) {
        if (order.getKind() == OrderKind.SELL) {
            BigDecimal limitBuy = order.getBuyAmount().multiply(fill.executedSell())
                    .divide(order.getSellAmount(), DecimalMath.MC);
            return fill.executedBuy().subtract(limitBuy);
        }
        BigDecimal limitSell = order.getSellAmount().multiply(fill.executedBuy())
                .divide(order.getBuyAmount(), DecimalMath.MC);
        return limitSell.subtract(fill.executedSell());
    }

    /**
     * Token a fill's surplus is denominated in.
     */
    public static Token surplusToken(Order order) {
        return order.getKind() == OrderKind.SELL ? order.getBuyToken() : order.getSellToken();
    }
}
