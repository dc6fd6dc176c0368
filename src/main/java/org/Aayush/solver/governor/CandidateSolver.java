package org.Aayush.solver.governor;

import org.Aayush.solver.domain.Solution;
import org.Aayush.solver.routing.CancellationSignal;

/**
 * Computes one scored candidate solution for one strategy.
 *
 * <p>Implementations must not share mutable state across calls; the governor runs several
 * candidates of the same run concurrently.</p>
 */
interface CandidateSolver {

    /**
     * @throws org.Aayush.solver.routing.CandidateCancelledException when {@code signal} is raised.
     */
    Solution solve(SolveStrategy strategy, SolveContext context, CancellationSignal signal);
}
