package org.Aayush.solver.matching;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.solver.domain.Fill;
import org.Aayush.solver.domain.Order;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of peer matching: fills in match order plus what is left for routing.
 */
@Value
@Builder
public class MatchResult {
    @Singular
    List<Fill> fills;
    /** Unfilled remainders in arrival sequence. */
    @Singular
    List<Residual> residuals;

    /**
     * Result for a strategy that skips matching: every order is an untouched residual.
     */
    public static MatchResult unmatched(List<Order> orders) {
        List<Residual> residuals = new ArrayList<>(orders.size());
        for (Order order : orders) {
            residuals.add(Residual.of(order));
        }
        return MatchResult.builder().residuals(residuals).build();
    }
}
