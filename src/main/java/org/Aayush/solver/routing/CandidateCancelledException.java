package org.Aayush.solver.routing;

import lombok.experimental.StandardException;

/**
 * Raised inside a candidate task after the governor requested cancellation.
 */
@StandardException
public class CandidateCancelledException extends RuntimeException {
}
