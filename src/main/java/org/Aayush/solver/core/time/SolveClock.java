package org.Aayush.solver.core.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Clock abstraction used by the solve governor for deadline handling.
 *
 * <p>All deadline math is saturating: an already-passed deadline yields zero remaining time,
 * never a negative wait.</p>
 */
public interface SolveClock {

    /**
     * Returns the current instant.
     */
    Instant now();

    /**
     * Returns remaining nanoseconds until {@code deadline}, clamped at zero.
     */
    default long remainingNanos(Instant deadline) {
        Objects.requireNonNull(deadline, "deadline");
        Instant now = now();
        if (!deadline.isAfter(now)) {
            return 0L;
        }
        try {
            return Duration.between(now, deadline).toNanos();
        } catch (ArithmeticException overflow) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Returns whether {@code deadline} is at or before the current instant.
     */
    default boolean hasPassed(Instant deadline) {
        return remainingNanos(deadline) == 0L;
    }

    /**
     * System UTC clock.
     */
    static SolveClock system() {
        return of(Clock.systemUTC());
    }

    /**
     * Adapts a {@link Clock}; fixed clocks make deadline behavior deterministic in tests.
     */
    static SolveClock of(Clock clock) {
        Objects.requireNonNull(clock, "clock");
        return clock::instant;
    }
}
