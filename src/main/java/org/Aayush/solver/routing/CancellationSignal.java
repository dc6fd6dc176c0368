package org.Aayush.solver.routing;

import org.Aayush.solver.core.time.SolveClock;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between the governor and one candidate task.
 *
 * <p>Long-running loops call {@link #checkpoint()}; it fails fast once the flag is raised, the
 * optional deadline has passed, or the worker thread has been interrupted.</p>
 */
public final class CancellationSignal {
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final SolveClock clock;
    private final Instant deadline;

    public CancellationSignal() {
        this(null, null);
    }

    private CancellationSignal(SolveClock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    /**
     * Signal that is only ever raised by thread interruption.
     */
    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    /**
     * Signal that also raises itself once {@code deadline} has passed on {@code clock}.
     */
    public static CancellationSignal until(SolveClock clock, Instant deadline) {
        return new CancellationSignal(
                Objects.requireNonNull(clock, "clock"),
                Objects.requireNonNull(deadline, "deadline")
        );
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get()
                || Thread.currentThread().isInterrupted()
                || (deadline != null && clock.hasPassed(deadline));
    }

    /**
     * @throws CandidateCancelledException when cancellation was requested.
     */
    public void checkpoint() {
        if (isCancelled()) {
            throw new CandidateCancelledException("candidate cancelled");
        }
    }
}
