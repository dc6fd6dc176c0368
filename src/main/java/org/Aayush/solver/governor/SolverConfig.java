package org.Aayush.solver.governor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.Aayush.solver.priority.SortingStrategy;
import org.Aayush.solver.routing.SearchBudget;

import java.math.BigDecimal;
import java.util.List;

/**
 * Runtime configuration of the solve governor.
 *
 * <p>{@link #defaults()} reads system properties; blank or unparsable values fall back to the
 * built-in defaults.</p>
 */
@Value
@Builder(toBuilder = true)
public class SolverConfig {
    public static final int DEFAULT_MAX_HOPS = 3;
    public static final int DEFAULT_SPLIT_CHUNKS = 8;
    public static final int DEFAULT_MAX_PARTIAL_ATTEMPTS = 4;
    public static final int DEFAULT_MAX_ORDERS = Integer.MAX_VALUE;

    static final String PROP_WORKER_THREADS = "solver.workerThreads";
    static final String PROP_MAX_HOPS = "solver.maxHops";
    static final String PROP_SPLIT_CHUNKS = "solver.splitChunks";
    static final String PROP_MAX_PARTIAL_ATTEMPTS = "solver.maxPartialAttempts";
    static final String PROP_INTERACTION_PENALTY = "solver.interactionPenalty";
    static final String PROP_MAX_ORDERS = "solver.maxOrders";

    /** Upper bound of concurrently running candidates. */
    @Builder.Default
    int workerThreads = defaultWorkerThreads();
    @Builder.Default
    int maxHops = DEFAULT_MAX_HOPS;
    @Builder.Default
    int splitChunks = DEFAULT_SPLIT_CHUNKS;
    @Builder.Default
    int maxPartialAttempts = DEFAULT_MAX_PARTIAL_ATTEMPTS;
    /** Numeraire cost per interaction charged by the scorer. */
    @NonNull
    @Builder.Default
    BigDecimal interactionPenalty = BigDecimal.ZERO;
    /** Cap on orders considered per auction after prioritization. */
    @Builder.Default
    int maxOrders = DEFAULT_MAX_ORDERS;
    @NonNull
    @Builder.Default
    SearchBudget searchBudget = SearchBudget.unbounded();
    /** Order ranking; empty keeps arrival sequence. */
    @Singular
    List<SortingStrategy> sortingStrategies;
    /** Custom candidate strategies merged with the built-ins. */
    @Singular
    List<SolveStrategy> strategies;

    /**
     * Loads configuration from system properties.
     */
    public static SolverConfig defaults() {
        return SolverConfig.builder()
                .workerThreads(readInt(PROP_WORKER_THREADS, defaultWorkerThreads()))
                .maxHops(readInt(PROP_MAX_HOPS, DEFAULT_MAX_HOPS))
                .splitChunks(readInt(PROP_SPLIT_CHUNKS, DEFAULT_SPLIT_CHUNKS))
                .maxPartialAttempts(readInt(PROP_MAX_PARTIAL_ATTEMPTS, DEFAULT_MAX_PARTIAL_ATTEMPTS))
                .interactionPenalty(readDecimal(PROP_INTERACTION_PENALTY, BigDecimal.ZERO))
                .maxOrders(readInt(PROP_MAX_ORDERS, DEFAULT_MAX_ORDERS))
                .searchBudget(SearchBudget.defaults())
                .build();
    }

    /**
     * Validates field ranges.
     *
     * @return this config.
     */
    public SolverConfig validate() {
        requirePositive(workerThreads, "workerThreads");
        requirePositive(maxHops, "maxHops");
        requirePositive(splitChunks, "splitChunks");
        requirePositive(maxPartialAttempts, "maxPartialAttempts");
        requirePositive(maxOrders, "maxOrders");
        if (interactionPenalty.signum() < 0) {
            throw new IllegalArgumentException("interactionPenalty must be >= 0, got " + interactionPenalty);
        }
        return this;
    }

    private static void requirePositive(int value, String fieldName) {
        if (value <= 0) {
            throw new IllegalArgumentException(fieldName + " must be > 0, got " + value);
        }
    }

    private static int defaultWorkerThreads() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static BigDecimal readDecimal(String property, BigDecimal fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            BigDecimal value = new BigDecimal(raw.trim());
            return value.signum() >= 0 ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
