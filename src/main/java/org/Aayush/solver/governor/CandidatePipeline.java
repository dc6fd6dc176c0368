package org.Aayush.solver.governor;

import org.Aayush.solver.domain.Fill;
import org.Aayush.solver.domain.Solution;
import org.Aayush.solver.liquidity.ReserveOverlay;
import org.Aayush.solver.matching.MatchResult;
import org.Aayush.solver.matching.PeerMatcher;
import org.Aayush.solver.routing.CancellationSignal;
import org.Aayush.solver.routing.OrderRouter;
import org.Aayush.solver.routing.RoutingOutcome;
import org.Aayush.solver.scoring.Scorer;
import org.Aayush.solver.settlement.SettlementEncoder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default candidate: optional peer matching, routing of the residuals from an empty overlay,
 * encoding and scoring.
 */
final class CandidatePipeline implements CandidateSolver {
    private final PeerMatcher peerMatcher;
    private final OrderRouter router;
    private final SettlementEncoder encoder;
    private final Scorer scorer;

    CandidatePipeline(PeerMatcher peerMatcher, OrderRouter router, SettlementEncoder encoder, Scorer scorer) {
        this.peerMatcher = Objects.requireNonNull(peerMatcher, "peerMatcher");
        this.router = Objects.requireNonNull(router, "router");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    @Override
    public Solution solve(SolveStrategy strategy, SolveContext context, CancellationSignal signal) {
        MatchResult matches = strategy.isPeerMatching()
                ? peerMatcher.match(context.orders())
                : MatchResult.unmatched(context.orders());
        signal.checkpoint();

        RoutingOutcome routing = router.route(
                context.graph(),
                ReserveOverlay.empty(),
                matches.getResiduals(),
                strategy.getMaxHops(),
                strategy.isSplitting(),
                signal
        );
        signal.checkpoint();

        List<Fill> fills = new ArrayList<>(matches.getFills().size() + routing.getFills().size());
        fills.addAll(matches.getFills());
        fills.addAll(routing.getFills());
        Solution solution = encoder.encode(
                context.auction().getId(),
                strategy.getId(),
                context.ordersById(),
                fills,
                routing.getInteractions(),
                context.referencePrices()
        );
        return scorer.scored(solution, context.ordersById());
    }
}
