package org.Aayush.solver.governor;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.solver.core.time.SolveClock;
import org.Aayush.solver.domain.Auction;
import org.Aayush.solver.domain.AuctionFactory;
import org.Aayush.solver.domain.AuctionInput;
import org.Aayush.solver.domain.Order;
import org.Aayush.solver.domain.OrderKind;
import org.Aayush.solver.domain.Solution;
import org.Aayush.solver.domain.Token;
import org.Aayush.solver.graph.GraphPriceEstimator;
import org.Aayush.solver.graph.LiquidityGraph;
import org.Aayush.solver.graph.LiquidityGraphBuilder;
import org.Aayush.solver.liquidity.ReserveOverlay;
import org.Aayush.solver.matching.PeerMatcher;
import org.Aayush.solver.priority.OrderPrioritizer;
import org.Aayush.solver.routing.CancellationSignal;
import org.Aayush.solver.routing.CandidateCancelledException;
import org.Aayush.solver.routing.OrderRouter;
import org.Aayush.solver.routing.Route;
import org.Aayush.solver.routing.RouteQuery;
import org.Aayush.solver.routing.RouteSearch;
import org.Aayush.solver.routing.SearchBudget;
import org.Aayush.solver.routing.SplitOptimizer;
import org.Aayush.solver.scoring.Scorer;
import org.Aayush.solver.settlement.SettlementEncoder;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs candidate strategies concurrently under a deadline and keeps the best-scored solution.
 *
 * <p><b>Run lifecycle:</b></p>
 * <ol>
 * <li>{@code IDLE}: when the deadline has already passed, the zero-fill baseline is returned
 * right away ({@code TIMED_OUT}) and no task starts.</li>
 * <li>{@code RUNNING}: shared inputs (graph, reference prices, prioritized orders) are built once
 * and the deadline is checked again; one task per registered strategy is submitted and the governor waits on a completion service
 * until all tasks finish or the deadline passes.</li>
 * <li>Tasks still running at the deadline are cancelled (interrupt plus cooperative flag) and the
 * run ends {@code TIMED_OUT}; otherwise it ends {@code COMPLETED}.</li>
 * </ol>
 *
 * <p><b>Selection:</b> highest score wins; equal scores go to the strategy registered first; the
 * baseline only wins ties against candidates without fills. A failing candidate is logged and
 * discarded; it never affects the others.</p>
 */
@Slf4j
public final class SolveGovernor implements BatchSolver {
    private final SolverConfig config;
    private final StrategyRegistry registry;
    private final SolveClock clock;
    private final OrderPrioritizer prioritizer;
    private final RouteSearch routeSearch;
    private final CandidateSolver candidateSolver;

    public SolveGovernor(SolverConfig config) {
        this(config, SolveClock.system());
    }

    public SolveGovernor(SolverConfig config, SolveClock clock) {
        this(config, clock, null);
    }

    SolveGovernor(SolverConfig config, SolveClock clock, CandidateSolver candidateSolver) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.registry = new StrategyRegistry(config.getMaxHops(), config.getStrategies());
        this.prioritizer = new OrderPrioritizer(config.getSortingStrategies(), clock);
        this.routeSearch = new RouteSearch(config.getSearchBudget(), new SplitOptimizer(config.getSplitChunks()));
        this.candidateSolver = candidateSolver != null
                ? candidateSolver
                : new CandidatePipeline(
                        new PeerMatcher(),
                        new OrderRouter(routeSearch, config.getMaxPartialAttempts()),
                        new SettlementEncoder(),
                        new Scorer(config.getInteractionPenalty())
                );
    }

    /**
     * Governor configured from system properties.
     */
    public static SolveGovernor withDefaults() {
        return new SolveGovernor(SolverConfig.defaults());
    }

    public SolverConfig config() {
        return config;
    }

    public StrategyRegistry registry() {
        return registry;
    }

    @Override
    public Solution solve(Auction auction, Instant deadline) {
        return solveWithReport(auction, deadline).getSolution();
    }

    @Override
    public Solution solve(AuctionInput input) {
        Auction auction = AuctionFactory.create(input, clock.now());
        return solve(auction, auction.getDeadline());
    }

    /**
     * Solves and reports per-candidate outcomes.
     */
    public SolveReport solveWithReport(Auction auction, Instant deadline) {
        Objects.requireNonNull(auction, "auction");
        Objects.requireNonNull(deadline, "deadline");
        Instant startedAt = clock.now();
        Solution baseline = Solution.empty(auction.getId());
        List<SolveStrategy> strategies = registry.strategies();

        if (clock.hasPassed(deadline)) {
            log.info("Auction {}: deadline {} already passed, returning baseline", auction.getId(), deadline);
            return timedOutBaseline(baseline, strategies, Duration.ZERO);
        }

        SolveContext context;
        try {
            context = prepare(auction);
        } catch (RuntimeException ex) {
            log.warn("Auction {}: preparation failed, returning baseline: {}", auction.getId(), ex.getMessage(), ex);
            SolveReport.SolveReportBuilder report = SolveReport.builder()
                    .solution(baseline)
                    .state(GovernorState.COMPLETED)
                    .elapsed(elapsedSince(startedAt));
            strategies.forEach(strategy -> report.failed(strategy.getId()));
            return report.build();
        }

        if (clock.hasPassed(deadline)) {
            log.info("Auction {}: deadline {} passed while preparing, returning baseline", auction.getId(), deadline);
            return timedOutBaseline(baseline, strategies, elapsedSince(startedAt));
        }
        log.info("Auction {}: solving {} orders over {} pools with {} strategies",
                auction.getId(), context.orders().size(), auction.getLiquidity().size(), strategies.size());
        return run(context, strategies, baseline, deadline, startedAt);
    }

    /**
     * Quotes one trade with route search over the request's liquidity.
     *
     * <p>The search stops at the request deadline, if any, and the quote is then unavailable.</p>
     */
    @Override
    public Quote quote(QuoteRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.getAmount().signum() <= 0
                || request.getSellToken().equals(request.getBuyToken())
                || (request.getDeadline() != null && clock.hasPassed(request.getDeadline()))) {
            return Quote.unavailable(request);
        }
        LiquidityGraph graph = LiquidityGraphBuilder.build(request.getAuction());
        RouteQuery query = new RouteQuery(
                request.getSellToken(),
                request.getBuyToken(),
                request.getSide(),
                request.getAmount(),
                null,
                config.getMaxHops(),
                true
        );
        CancellationSignal signal = request.getDeadline() == null
                ? CancellationSignal.none()
                : CancellationSignal.until(clock, request.getDeadline());
        Route route;
        try {
            route = routeSearch.find(graph, ReserveOverlay.empty(), query, signal);
        } catch (SearchBudget.BudgetExceededException | CandidateCancelledException ex) {
            log.warn("Quote {} -> {} aborted: {}", request.getSellToken(), request.getBuyToken(), ex.getMessage());
            return Quote.unavailable(request);
        }
        if (route == null) {
            return Quote.unavailable(request);
        }
        BigDecimal sellAmount = request.getSide() == OrderKind.SELL ? request.getAmount() : route.amountIn();
        BigDecimal buyAmount = request.getSide() == OrderKind.SELL ? route.amountOut() : request.getAmount();
        return Quote.builder()
                .sellToken(request.getSellToken())
                .buyToken(request.getBuyToken())
                .side(request.getSide())
                .available(true)
                .sellAmount(sellAmount)
                .buyAmount(buyAmount)
                .interactions(route.interactions())
                .clearingPrice(request.getSellToken(), buyAmount)
                .clearingPrice(request.getBuyToken(), sellAmount)
                .build();
    }

    private static SolveReport timedOutBaseline(Solution baseline, List<SolveStrategy> strategies, Duration elapsed) {
        SolveReport.SolveReportBuilder report = SolveReport.builder()
                .solution(baseline)
                .state(GovernorState.TIMED_OUT)
                .elapsed(elapsed);
        strategies.forEach(strategy -> report.cancelled(strategy.getId()));
        return report.build();
    }

    private SolveContext prepare(Auction auction) {
        LiquidityGraph graph = LiquidityGraphBuilder.build(auction);
        Map<Token, BigDecimal> prices = GraphPriceEstimator.estimate(graph, auction.getReferencePrices());
        List<Order> orders = auction.getOrders().isEmpty()
                ? List.of()
                : prioritizer.prioritize(auction.getOrders(), prices, config.getMaxOrders());
        return new SolveContext(auction, graph, orders, auction.ordersById(), prices);
    }

    private SolveReport run(
            SolveContext context,
            List<SolveStrategy> strategies,
            Solution baseline,
            Instant deadline,
            Instant startedAt
    ) {
        String auctionId = context.auction().getId();
        int taskCount = strategies.size();
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(config.getWorkerThreads(), taskCount),
                workerThreadFactory(auctionId)
        );
        CompletionService<Solution> completion = new ExecutorCompletionService<>(executor);
        Map<Future<Solution>, Integer> indexByFuture = new HashMap<>();
        List<Future<Solution>> futures = new ArrayList<>(taskCount);
        List<CancellationSignal> signals = new ArrayList<>(taskCount);
        Solution[] results = new Solution[taskCount];
        boolean[] failed = new boolean[taskCount];
        boolean[] cancelled = new boolean[taskCount];
        boolean timedOut = false;

        try {
            for (int i = 0; i < taskCount; i++) {
                SolveStrategy strategy = strategies.get(i);
                CancellationSignal signal = new CancellationSignal();
                signals.add(signal);
                Future<Solution> future = completion.submit(() -> candidateSolver.solve(strategy, context, signal));
                futures.add(future);
                indexByFuture.put(future, i);
            }

            int pending = taskCount;
            while (pending > 0) {
                long remainingNanos = clock.remainingNanos(deadline);
                if (remainingNanos == 0L) {
                    timedOut = true;
                    break;
                }
                Future<Solution> done = completion.poll(remainingNanos, TimeUnit.NANOSECONDS);
                if (done == null) {
                    timedOut = true;
                    break;
                }
                pending--;
                int index = indexByFuture.get(done);
                String strategyId = strategies.get(index).getId();
                try {
                    results[index] = done.get();
                    log.debug("Auction {}: candidate {} scored {}", auctionId, strategyId, results[index].getScore());
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof CandidateCancelledException) {
                        cancelled[index] = true;
                        log.debug("Auction {}: candidate {} cancelled", auctionId, strategyId);
                    } else {
                        failed[index] = true;
                        log.warn("Auction {}: candidate {} failed: {}", auctionId, strategyId, cause.getMessage(), cause);
                    }
                } catch (CancellationException ex) {
                    cancelled[index] = true;
                    log.debug("Auction {}: candidate {} cancelled", auctionId, strategyId);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            timedOut = true;
            log.warn("Auction {}: governor interrupted while waiting for candidates", auctionId);
        } finally {
            for (int i = 0; i < futures.size(); i++) {
                Future<Solution> future = futures.get(i);
                if (!future.isDone() || (results[i] == null && !failed[i] && !cancelled[i])) {
                    signals.get(i).cancel();
                    future.cancel(true);
                    cancelled[i] = true;
                    log.debug("Auction {}: cancelling candidate {}", auctionId, strategies.get(i).getId());
                }
            }
            executor.shutdownNow();
        }

        Solution best = baseline;
        SolveReport.SolveReportBuilder report = SolveReport.builder();
        for (int i = 0; i < taskCount; i++) {
            String strategyId = strategies.get(i).getId();
            if (failed[i]) {
                report.failed(strategyId);
                continue;
            }
            if (cancelled[i] || results[i] == null) {
                report.cancelled(strategyId);
                continue;
            }
            report.completed(strategyId);
            if (beats(results[i], best)) {
                best = results[i];
            }
        }

        GovernorState state = timedOut ? GovernorState.TIMED_OUT : GovernorState.COMPLETED;
        Duration elapsed = elapsedSince(startedAt);
        log.info("Auction {}: {} in {} ms, winner={}, score={}, fills={}",
                auctionId, state, elapsed.toMillis(), best.getStrategyId(), best.getScore(), best.getFills().size());
        return report.solution(best).state(state).elapsed(elapsed).build();
    }

    /**
     * Strictly higher score wins; on equal score a solution with fills beats the baseline.
     */
    static boolean beats(Solution candidate, Solution incumbent) {
        int cmp = candidate.getScore().compareTo(incumbent.getScore());
        if (cmp != 0) {
            return cmp > 0;
        }
        return Solution.BASELINE_STRATEGY_ID.equals(incumbent.getStrategyId()) && !candidate.isEmpty();
    }

    private Duration elapsedSince(Instant startedAt) {
        Duration elapsed = Duration.between(startedAt, clock.now());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    private static ThreadFactory workerThreadFactory(String auctionId) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "solver-" + auctionId + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
