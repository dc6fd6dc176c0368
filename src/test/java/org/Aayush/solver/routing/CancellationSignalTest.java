package org.Aayush.solver.routing;

import org.Aayush.solver.core.time.SolveClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CancellationSignalTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    @DisplayName("Flag: checkpoint passes until cancel is requested")
    void testExplicitCancel() {
        CancellationSignal signal = CancellationSignal.none();

        assertDoesNotThrow(signal::checkpoint);
        signal.cancel();

        assertTrue(signal.isCancelled());
        assertThrows(CandidateCancelledException.class, signal::checkpoint);
    }

    @Test
    @DisplayName("Deadline: signal raises itself once the clock reaches the deadline")
    void testDeadlineBoundSignal() {
        AtomicReference<Instant> time = new AtomicReference<>(NOW);
        SolveClock clock = time::get;
        CancellationSignal signal = CancellationSignal.until(clock, NOW.plusSeconds(1));

        assertFalse(signal.isCancelled());
        time.set(NOW.plusSeconds(1));

        assertTrue(signal.isCancelled());
        assertThrows(CandidateCancelledException.class, signal::checkpoint);
    }

    @Test
    @DisplayName("Validation: deadline-bound signal requires clock and deadline")
    void testValidation() {
        assertThrows(NullPointerException.class, () -> CancellationSignal.until(null, NOW));
        assertThrows(NullPointerException.class, () -> CancellationSignal.until(() -> NOW, null));
    }
}
