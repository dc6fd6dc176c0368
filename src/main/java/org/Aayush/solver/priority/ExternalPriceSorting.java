package org.Aayush.solver.priority;

import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.liquidity.DecimalMath;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;

/**
 * Likelihood ranking: {@code sellAmount·price(sell) / (buyAmount·price(buy))}.
 */
final class ExternalPriceSorting implements SortingStrategy {
    private final double minFraction;

    ExternalPriceSorting(double minFraction) {
        this.minFraction = SortingSupport.validateFraction(minFraction);
    }

    @Override
    public String id() {
        return "EXTERNAL_PRICE";
    }

    @Override
    public double minFraction() {
        return minFraction;
    }

    @Override
    public Comparator<Order> comparator(Map<Token, BigDecimal> prices, Instant now) {
        return SortingSupport.descendingNullsLast(order -> {
            BigDecimal sold = SortingSupport.value(order.getSellAmount(), order.getSellToken(), prices);
            BigDecimal bought = SortingSupport.value(order.getBuyAmount(), order.getBuyToken(), prices);
            if (sold == null || bought == null || bought.signum() == 0) {
                return null;
            }
            return sold.divide(bought, DecimalMath.MC);
        });
    }
}
