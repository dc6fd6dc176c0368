package org.Aayush.solver.priority;

import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.Token;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;

/**
 * Ranking rule applied to pending orders before solving.
 *
 * <p>A strategy supplies a comparator that puts the most important order first, plus the minimum
 * fraction of the order budget reserved for its own top-ranked orders.</p>
 */
public interface SortingStrategy {

    /**
     * Stable identifier used in logs and configuration.
     */
    String id();

    /**
     * Fraction of {@code maxOrders} reserved for this strategy's top orders, within {@code [0, 1]}.
     */
    double minFraction();

    /**
     * Builds a most-important-first comparator.
     *
     * @param prices reference prices in the common numeraire.
     * @param now evaluation instant.
     */
    Comparator<Order> comparator(Map<Token, BigDecimal> prices, Instant now);

    /**
     * Orders ranked by likelihood of execution: value sold over value bought under reference
     * prices, highest first. Orders touching an unpriced token rank last.
     */
    static SortingStrategy externalPrice(double minFraction) {
        return new ExternalPriceSorting(minFraction);
    }

    /**
     * Orders ranked by value sold minus value bought under reference prices, highest first.
     * Orders touching an unpriced token rank last.
     */
    static SortingStrategy externalSurplus(double minFraction) {
        return new ExternalSurplusSorting(minFraction);
    }

    /**
     * Newest orders first. With {@code maxAge}, orders created before {@code now - maxAge}, or
     * without creation time, rank last.
     *
     * @param maxAge optional age limit, may be null.
     */
    static SortingStrategy creationTimestamp(double minFraction, Duration maxAge) {
        return new CreationTimestampSorting(minFraction, maxAge);
    }
}
