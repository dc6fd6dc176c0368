package org.Aayush.solver.governor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Configuration of one candidate solving pipeline.
 */
@Value
@Builder(toBuilder = true)
public class SolveStrategy {
    @NonNull
    String id;
    /** Hop limit for route search. */
    int maxHops;
    /** Whether peer matching runs before routing; on unless a strategy opts out. */
    @Builder.Default
    boolean peerMatching = true;
    /** Whether route hops may be split across parallel pools. */
    boolean splitting;

    /**
     * Validates field ranges.
     *
     * @return this strategy.
     */
    public SolveStrategy validate() {
        if (id.isBlank()) {
            throw new IllegalArgumentException("strategy id must be non-blank");
        }
        if (maxHops <= 0) {
            throw new IllegalArgumentException("strategy " + id + ": maxHops must be > 0, got " + maxHops);
        }
        return this;
    }
}
