package org.Aayush.solver.routing;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.solver.domain.Fill;
import org.Aayush.solver.domain.Interaction;
import org.Aayush.solver.liquidity.ReserveOverlay;

import java.util.List;

/**
 * Result of routing a batch of residual orders.
 */
@Value
@Builder
public class RoutingOutcome {
    /** Routed fills in commit order. */
    @Singular
    List<Fill> fills;
    /** Interactions of all committed routes in commit order. */
    @Singular
    List<Interaction> interactions;
    /** Orders that found no acceptable route. */
    @Singular
    List<String> unfilledOrderIds;
    /** Reserve state after all committed routes. */
    @NonNull
    ReserveOverlay overlay;
}
