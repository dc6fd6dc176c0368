package org.Aayush.solver.governor;

/**
 * Lifecycle of one solve run: {@code IDLE -> RUNNING -> {COMPLETED, TIMED_OUT}}.
 */
public enum GovernorState {
    IDLE,
    RUNNING,
    /** Every candidate finished (successfully or not) before the deadline. */
    COMPLETED,
    /** The deadline passed with candidates still running, or had passed before the run. */
    TIMED_OUT
}
