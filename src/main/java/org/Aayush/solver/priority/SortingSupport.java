package org.Aayush.solver.priority;

import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.Map;
import java.util.function.Function;

final class SortingSupport {

    private SortingSupport() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    static double validateFraction(double minFraction) {
        if (!Double.isFinite(minFraction) || minFraction < 0.0d || minFraction > 1.0d) {
            throw new IllegalArgumentException("minFraction must be within [0, 1], got " + minFraction);
        }
        return minFraction;
    }

    static BigDecimal value(BigDecimal amount, Token token, Map<Token, BigDecimal> prices) {
        BigDecimal price = prices.get(token);
        return price == null ? null : amount.multiply(price);
    }

    // null keys sort after every real key
    static <K extends Comparable<? super K>> Comparator<Order> descendingNullsLast(Function<Order, K> key) {
        return Comparator.comparing(key, Comparator.nullsLast(Comparator.<K>reverseOrder()));
    }
}
