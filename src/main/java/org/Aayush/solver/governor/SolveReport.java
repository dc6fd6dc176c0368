package org.Aayush.solver.governor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.solver.domain.Solution;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one solve run with per-candidate bookkeeping.
 */
@Value
@Builder
public class SolveReport {
    /** Selected solution; the zero baseline when no candidate beat it. */
    @NonNull
    Solution solution;
    @NonNull
    GovernorState state;
    @Singular("completed")
    List<String> completedStrategies;
    @Singular("failed")
    List<String> failedStrategies;
    /** Strategies stopped at the deadline or never started. */
    @Singular("cancelled")
    List<String> cancelledStrategies;
    @NonNull
    Duration elapsed;

    /**
     * Strategy id of the selected solution.
     */
    public String winningStrategyId() {
        return solution.getStrategyId();
    }

    public boolean timedOut() {
        return state == GovernorState.TIMED_OUT;
    }
}
