package org.Aayush.solver.priority;

import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;

/**
 * Recency ranking with an optional age cut-off.
 */
final class CreationTimestampSorting implements SortingStrategy {
    private final double minFraction;
    private final Duration maxAge;

    CreationTimestampSorting(double minFraction, Duration maxAge) {
        this.minFraction = SortingSupport.validateFraction(minFraction);
        if (maxAge != null && maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be >= 0, got " + maxAge);
        }
        this.maxAge = maxAge;
    }

    @Override
    public String id() {
        return "CREATION_TIMESTAMP";
    }

    @Override
    public double minFraction() {
        return minFraction;
    }

    @Override
    public Comparator<Order> comparator(Map<Token, BigDecimal> prices, Instant now) {
        Instant earliestAllowed = maxAge == null ? null : now.minus(maxAge);
        return SortingSupport.descendingNullsLast(order -> {
            Instant created = order.getCreatedAt();
            if (created == null || (earliestAllowed != null && created.isBefore(earliestAllowed))) {
                return null;
            }
            return created;
        });
    }
}
