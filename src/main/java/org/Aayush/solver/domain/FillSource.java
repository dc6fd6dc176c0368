package org.Aayush.solver.domain;

/**
 * Origin of a fill.
 */
public enum FillSource {
    /** Settled directly against an opposing order. */
    PEER_MATCH,
    /** Settled through one or more liquidity pools. */
    ROUTED
}
