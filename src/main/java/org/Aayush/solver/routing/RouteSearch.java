package org.Aayush.solver.routing;

import it.unimi.dsi.fastutil.booleans.BooleanArrayList;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.solver.domain.Interaction;
import org.Aayush.solver.domain.OrderKind;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.graph.LiquidityGraph;
import org.Aayush.solver.liquidity.DecimalMath;
import org.Aayush.solver.liquidity.LiquidityPool;
import org.Aayush.solver.liquidity.ReserveOverlay;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Bounded best-first search for the best simple route of one trade.
 *
 * <p>The search grows paths one hop at a time from an anchor token and keeps them simple: no
 * token and no pool appears twice. Two directions are supported:</p>
 * <ul>
 * <li>{@link OrderKind#SELL}: forward from the sell token with the exact sell amount, each hop
 * quoted with {@code quote}; the best route has the largest output.</li>
 * <li>{@link OrderKind#BUY}: backward from the buy token with the exact buy amount, each hop
 * quoted with {@code quoteInverse}; the best route has the smallest input.</li>
 * </ul>
 *
 * <p>Frontier priority is the optimistic final amount from a {@link RateBoundTable} rebuilt for
 * every query under the current overlay. A path whose optimistic amount cannot beat the best
 * complete route (or the query limit) is pruned, and the search stops once the frontier head
 * cannot. Labels at the same token are dominance-filtered: a label is dropped when another label
 * reached the token with a better-or-equal amount in no more hops over a subset of its tokens
 * and pools.</p>
 *
 * <p>Each hop takes the best single pool among parallel edges; with splitting enabled it uses a
 * {@link SplitOptimizer} allocation when that is strictly better.</p>
 */
@Slf4j
public final class RouteSearch {
    private static final int NO_LABEL = -1;
    // absorbs rounding in rate products and the stable-swap probe estimate
    private static final BigDecimal BOUND_SLACK = BigDecimal.ONE.add(BigDecimal.ONE.movePointLeft(9));

    private final SearchBudget budget;
    private final SplitOptimizer splitOptimizer;

    public RouteSearch(SearchBudget budget, SplitOptimizer splitOptimizer) {
        this.budget = Objects.requireNonNull(budget, "budget");
        this.splitOptimizer = Objects.requireNonNull(splitOptimizer, "splitOptimizer");
    }

    public SearchBudget budget() {
        return budget;
    }

    /**
     * Finds the best route for one query.
     *
     * @return best route, or null when no route within {@code maxHops} reaches the limit.
     * @throws SearchBudget.BudgetExceededException when search work exceeds the budget.
     * @throws CandidateCancelledException when {@code signal} is raised mid-search.
     */
    public Route find(LiquidityGraph graph, ReserveOverlay overlay, RouteQuery query, CancellationSignal signal) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(overlay, "overlay");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(signal, "signal");
        int sellNode = graph.nodeOf(query.sellToken());
        int buyNode = graph.nodeOf(query.buyToken());
        if (sellNode < 0 || buyNode < 0 || sellNode == buyNode) {
            return null;
        }
        boolean forward = query.side() == OrderKind.SELL;
        int startNode = forward ? sellNode : buyNode;
        int goalNode = forward ? buyNode : sellNode;
        RateBoundTable bounds = forward
                ? RateBoundTable.towards(graph, overlay, goalNode, query.maxHops())
                : RateBoundTable.from(graph, overlay, goalNode, query.maxHops());
        return new Query(graph, overlay, query, signal, bounds, forward, startNode, goalNode).run();
    }

    /**
     * Per-query mutable search state.
     */
    private final class Query {
        private final LiquidityGraph graph;
        private final ReserveOverlay overlay;
        private final RouteQuery request;
        private final CancellationSignal signal;
        private final RateBoundTable bounds;
        private final boolean forward;
        private final int startNode;
        private final int goalNode;

        private final LabelStore labels = new LabelStore();
        private final IntArrayList[] activeLabelsByNode;
        private final PriorityQueue<FrontierState> frontier = new PriorityQueue<>();
        private final LiquidityGraph.EdgeIterator edges;

        private int bestGoalLabel = NO_LABEL;
        private int expansions;

        Query(
                LiquidityGraph graph,
                ReserveOverlay overlay,
                RouteQuery request,
                CancellationSignal signal,
                RateBoundTable bounds,
                boolean forward,
                int startNode,
                int goalNode
        ) {
            this.graph = graph;
            this.overlay = overlay;
            this.request = request;
            this.signal = signal;
            this.bounds = bounds;
            this.forward = forward;
            this.startNode = startNode;
            this.goalNode = goalNode;
            this.activeLabelsByNode = new IntArrayList[graph.nodeCount()];
            this.edges = graph.iterator();
        }

        Route run() {
            BigDecimal startOptimistic = optimistic(request.amount(), startNode, request.maxHops());
            if (startOptimistic == null || cannotBeat(startOptimistic)) {
                return null;
            }
            int startLabel = labels.add(startNode, 0, request.amount(), NO_LABEL, null);
            activate(startNode, startLabel);
            frontier.add(new FrontierState(startLabel, 0, rank(startOptimistic)));

            while (!frontier.isEmpty()) {
                FrontierState state = frontier.poll();
                int labelId = state.labelId();
                if (!labels.isActive(labelId)) {
                    continue;
                }
                signal.checkpoint();
                budget.checkExpansions(++expansions);

                BigDecimal headOptimistic = optimistic(labels.amount(labelId), labels.node(labelId),
                        request.maxHops() - labels.hops(labelId));
                if (headOptimistic == null || cannotBeat(headOptimistic)) {
                    break;
                }
                expand(labelId);
            }

            if (bestGoalLabel == NO_LABEL) {
                return null;
            }
            Route route = new Route(buildLegs(bestGoalLabel));
            log.debug("Route {} -> {} ({}): {} hops, in={}, out={}, expansions={}",
                    request.sellToken(), request.buyToken(), request.side(),
                    route.hops(), route.amountIn(), route.amountOut(), expansions);
            return route;
        }

        private void expand(int labelId) {
            int node = labels.node(labelId);
            int hops = labels.hops(labelId);
            if (hops >= request.maxHops()) {
                return;
            }
            BigDecimal amount = labels.amount(labelId);
            PathSets path = pathSets(labelId);

            // neighbor -> candidate edges, in edge order
            Int2ObjectLinkedOpenHashMap<IntList> byNeighbor = new Int2ObjectLinkedOpenHashMap<>();
            if (forward) {
                edges.resetOutgoing(node);
            } else {
                edges.resetIncoming(node);
            }
            while (edges.hasNext()) {
                int edgeId = edges.next();
                int neighbor = forward ? graph.getEdgeDestination(edgeId) : graph.getEdgeOrigin(edgeId);
                if (path.nodes().contains(neighbor) || path.pools().contains(graph.getEdgePool(edgeId).getId())) {
                    continue;
                }
                IntList candidates = byNeighbor.get(neighbor);
                if (candidates == null) {
                    candidates = new IntArrayList();
                    byNeighbor.put(neighbor, candidates);
                }
                candidates.add(edgeId);
            }

            for (Int2ObjectMap.Entry<IntList> entry : byNeighbor.int2ObjectEntrySet()) {
                int neighbor = entry.getIntKey();
                RouteLeg leg = evaluateHop(node, neighbor, amount, entry.getValue());
                if (leg == null) {
                    continue;
                }
                BigDecimal nextAmount = forward ? leg.amountOut() : leg.amountIn();
                int nextHops = hops + 1;
                if (neighbor == goalNode) {
                    offerGoal(neighbor, nextHops, nextAmount, labelId, leg);
                    continue;
                }
                if (nextHops >= request.maxHops()) {
                    continue;
                }
                BigDecimal nextOptimistic = optimistic(nextAmount, neighbor, request.maxHops() - nextHops);
                if (nextOptimistic == null || cannotBeat(nextOptimistic)) {
                    continue;
                }
                int nextLabel = addLabelIfNonDominated(neighbor, nextHops, nextAmount, labelId, leg);
                if (nextLabel == NO_LABEL) {
                    continue;
                }
                frontier.add(new FrontierState(nextLabel, nextHops, rank(nextOptimistic)));
                budget.checkFrontierSize(frontier.size());
            }
        }

        private void offerGoal(int node, int hops, BigDecimal amount, int predecessor, RouteLeg leg) {
            if (!meetsLimit(amount)) {
                return;
            }
            if (bestGoalLabel != NO_LABEL && !better(amount, labels.amount(bestGoalLabel))) {
                return;
            }
            bestGoalLabel = labels.add(node, hops, amount, predecessor, leg);
        }

        private RouteLeg evaluateHop(int node, int neighbor, BigDecimal amount, IntList candidateEdges) {
            Token tokenIn = forward ? graph.token(node) : graph.token(neighbor);
            Token tokenOut = forward ? graph.token(neighbor) : graph.token(node);
            List<LiquidityPool> pools = new ArrayList<>(candidateEdges.size());
            RouteLeg best = null;
            for (int i = 0; i < candidateEdges.size(); i++) {
                LiquidityPool pool = overlay.resolve(graph.getEdgePool(candidateEdges.getInt(i)));
                pools.add(pool);
                RouteLeg leg;
                if (forward) {
                    BigDecimal out = pool.quote(tokenIn, tokenOut, amount);
                    leg = out == null ? null : RouteLeg.single(pool, tokenIn, tokenOut, amount, out);
                } else {
                    BigDecimal in = pool.quoteInverse(tokenIn, tokenOut, amount);
                    leg = in == null ? null : RouteLeg.single(pool, tokenIn, tokenOut, in, amount);
                }
                if (leg != null && (best == null || better(legAmount(leg), legAmount(best)))) {
                    best = leg;
                }
            }
            if (request.splitting() && pools.size() > 1) {
                RouteLeg split = forward
                        ? splitOptimizer.splitSell(pools, tokenIn, tokenOut, amount)
                        : splitOptimizer.splitBuy(pools, tokenIn, tokenOut, amount);
                if (split != null && split.isSplit() && (best == null || better(legAmount(split), legAmount(best)))) {
                    best = split;
                }
            }
            return best;
        }

        private BigDecimal legAmount(RouteLeg leg) {
            return forward ? leg.amountOut() : leg.amountIn();
        }

        /**
         * Optimistic final amount: output bound for forward search, input bound for backward.
         */
        private BigDecimal optimistic(BigDecimal amount, int node, int remainingHops) {
            BigDecimal rate = bounds.bound(node, remainingHops);
            if (rate == null) {
                return null;
            }
            return forward
                    ? amount.multiply(rate, DecimalMath.MC)
                    : amount.divide(rate, DecimalMath.MC);
        }

        private boolean cannotBeat(BigDecimal optimistic) {
            BigDecimal loosened = forward
                    ? optimistic.multiply(BOUND_SLACK, DecimalMath.MC)
                    : optimistic.divide(BOUND_SLACK, DecimalMath.MC);
            if (bestGoalLabel != NO_LABEL && !better(loosened, labels.amount(bestGoalLabel))) {
                return true;
            }
            return !meetsLimit(loosened);
        }

        private boolean meetsLimit(BigDecimal amount) {
            BigDecimal limit = request.limitAmount();
            if (limit == null) {
                return true;
            }
            int cmp = amount.compareTo(limit);
            return forward ? cmp >= 0 : cmp <= 0;
        }

        private boolean better(BigDecimal candidate, BigDecimal incumbent) {
            int cmp = candidate.compareTo(incumbent);
            return forward ? cmp > 0 : cmp < 0;
        }

        // min-heap key: best optimistic amount first
        private BigDecimal rank(BigDecimal optimistic) {
            return forward ? optimistic.negate() : optimistic;
        }

        private int addLabelIfNonDominated(int node, int hops, BigDecimal amount, int predecessor, RouteLeg leg) {
            IntArrayList active = activeLabelsByNode[node];
            if (active == null) {
                active = new IntArrayList();
                activeLabelsByNode[node] = active;
            }
            PathSets candidatePath = null;
            int index = 0;
            while (index < active.size()) {
                int activeLabel = active.getInt(index);
                if (!labels.isActive(activeLabel)) {
                    active.removeInt(index);
                    continue;
                }
                if (candidatePath == null) {
                    candidatePath = pathSets(predecessor).with(node, leg);
                }
                PathSets activePath = pathSets(activeLabel);
                if (dominates(labels.hops(activeLabel), labels.amount(activeLabel), activePath, hops, amount, candidatePath)) {
                    return NO_LABEL;
                }
                if (dominates(hops, amount, candidatePath, labels.hops(activeLabel), labels.amount(activeLabel), activePath)) {
                    labels.deactivate(activeLabel);
                    active.removeInt(index);
                    continue;
                }
                index++;
            }
            int labelId = labels.add(node, hops, amount, predecessor, leg);
            activate(node, labelId);
            return labelId;
        }

        private boolean dominates(int lhsHops, BigDecimal lhsAmount, PathSets lhsPath, int rhsHops, BigDecimal rhsAmount, PathSets rhsPath) {
            int cmp = lhsAmount.compareTo(rhsAmount);
            boolean amountNoWorse = forward ? cmp >= 0 : cmp <= 0;
            return lhsHops <= rhsHops
                    && amountNoWorse
                    && rhsPath.nodes().containsAll(lhsPath.nodes())
                    && rhsPath.pools().containsAll(lhsPath.pools());
        }

        private void activate(int node, int labelId) {
            IntArrayList active = activeLabelsByNode[node];
            if (active == null) {
                active = new IntArrayList();
                activeLabelsByNode[node] = active;
            }
            if (!active.contains(labelId)) {
                active.add(labelId);
            }
        }

        private PathSets pathSets(int labelId) {
            Set<Integer> nodes = new HashSet<>();
            Set<String> pools = new HashSet<>();
            int cursor = labelId;
            while (cursor != NO_LABEL) {
                nodes.add(labels.node(cursor));
                RouteLeg leg = labels.leg(cursor);
                if (leg != null) {
                    for (Interaction interaction : leg.interactions()) {
                        pools.add(interaction.poolId());
                    }
                }
                cursor = labels.predecessor(cursor);
            }
            return new PathSets(nodes, pools);
        }

        private List<RouteLeg> buildLegs(int terminalLabel) {
            List<RouteLeg> chain = new ArrayList<>();
            int cursor = terminalLabel;
            while (cursor != NO_LABEL) {
                RouteLeg leg = labels.leg(cursor);
                if (leg != null) {
                    chain.add(leg);
                }
                cursor = labels.predecessor(cursor);
            }
            // backward search already walks legs from the sell token outward
            if (forward) {
                List<RouteLeg> reversed = new ArrayList<>(chain.size());
                for (int i = chain.size() - 1; i >= 0; i--) {
                    reversed.add(chain.get(i));
                }
                return reversed;
            }
            return chain;
        }
    }

    /**
     * Tokens and pools already used by a partial path.
     */
    private record PathSets(Set<Integer> nodes, Set<String> pools) {
        PathSets with(int node, RouteLeg leg) {
            Set<Integer> nextNodes = new HashSet<>(nodes);
            nextNodes.add(node);
            Set<String> nextPools = new HashSet<>(pools);
            for (Interaction interaction : leg.interactions()) {
                nextPools.add(interaction.poolId());
            }
            return new PathSets(nextNodes, nextPools);
        }
    }

    /**
     * Structure-of-arrays label storage; label ids are stable for predecessor backtracking.
     */
    private static final class LabelStore {
        private final IntArrayList nodeByLabel = new IntArrayList();
        private final IntArrayList hopsByLabel = new IntArrayList();
        private final ObjectArrayList<BigDecimal> amountByLabel = new ObjectArrayList<>();
        private final IntArrayList predecessorByLabel = new IntArrayList();
        private final ObjectArrayList<RouteLeg> legByLabel = new ObjectArrayList<>();
        private final BooleanArrayList activeByLabel = new BooleanArrayList();

        int add(int node, int hops, BigDecimal amount, int predecessor, RouteLeg leg) {
            int labelId = nodeByLabel.size();
            nodeByLabel.add(node);
            hopsByLabel.add(hops);
            amountByLabel.add(amount);
            predecessorByLabel.add(predecessor);
            legByLabel.add(leg);
            activeByLabel.add(true);
            return labelId;
        }

        int node(int labelId) {
            return nodeByLabel.getInt(labelId);
        }

        int hops(int labelId) {
            return hopsByLabel.getInt(labelId);
        }

        BigDecimal amount(int labelId) {
            return amountByLabel.get(labelId);
        }

        int predecessor(int labelId) {
            return predecessorByLabel.getInt(labelId);
        }

        /**
         * Leg that led into the label's token; null for the start label.
         */
        RouteLeg leg(int labelId) {
            return legByLabel.get(labelId);
        }

        boolean isActive(int labelId) {
            return activeByLabel.getBoolean(labelId);
        }

        void deactivate(int labelId) {
            activeByLabel.set(labelId, false);
        }
    }

    private record FrontierState(
            int labelId,
            int hops,
            BigDecimal rank
    ) implements Comparable<FrontierState> {
        /**
         * Orders frontier by rank, then fewer hops, then label id for stability.
         */
        @Override
        public int compareTo(FrontierState other) {
            int byRank = this.rank.compareTo(other.rank);
            if (byRank != 0) {
                return byRank;
            }
            int byHops = Integer.compare(this.hops, other.hops);
            if (byHops != 0) {
                return byHops;
            }
            return Integer.compare(this.labelId, other.labelId);
        }
    }
}
