package org.Aayush.solver.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Candidate settlement for one auction.
 *
 * <p>When {@code fills} is empty the solution is the "do nothing" baseline and its score is
 * exactly zero.</p>
 */
@Value
@Builder(toBuilder = true)
public class Solution {
    public static final String BASELINE_STRATEGY_ID = "BASELINE";

    @NonNull
    String auctionId;
    /** Strategy that produced this solution. */
    @NonNull
    String strategyId;
    @Singular
    List<Fill> fills;
    /** Execution plan in pool consumption order. */
    @Singular
    List<Interaction> interactions;
    /** Token value in the common numeraire, for reporting and surplus accounting. */
    @Singular
    Map<Token, BigDecimal> clearingPrices;
    @NonNull
    @Builder.Default
    BigDecimal score = BigDecimal.ZERO;

    /**
     * Creates the zero-fill baseline.
     */
    public static Solution empty(String auctionId) {
        return Solution.builder()
                .auctionId(auctionId)
                .strategyId(BASELINE_STRATEGY_ID)
                .build();
    }

    /**
     * Returns whether this is a zero-fill solution.
     */
    public boolean isEmpty() {
        return fills.isEmpty();
    }

    /**
     * Returns a copy with the given score.
     */
    public Solution withScore(BigDecimal newScore) {
        return toBuilder().score(newScore).build();
    }
}
