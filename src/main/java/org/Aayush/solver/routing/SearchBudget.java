package org.Aayush.solver.routing;

/**
 * Per-query deterministic bounds for route-search work and memory growth.
 */
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_EXPANSIONS_EXCEEDED = "SEARCH_EXPANSIONS_EXCEEDED";
    public static final String REASON_FRONTIER_EXCEEDED = "SEARCH_FRONTIER_EXCEEDED";

    static final String PROP_MAX_FRONTIER = "solver.search.maxFrontier";
    static final String PROP_MAX_EXPANSIONS = "solver.search.maxExpansions";

    private final int maxFrontierSize;
    private final int maxExpansions;

    private SearchBudget(int maxFrontierSize, int maxExpansions) {
        this.maxFrontierSize = normalizeBound(maxFrontierSize);
        this.maxExpansions = normalizeBound(maxExpansions);
    }

    /**
     * Creates a budget with explicit bounds; non-positive values mean unbounded.
     */
    public static SearchBudget of(int maxFrontierSize, int maxExpansions) {
        return new SearchBudget(maxFrontierSize, maxExpansions);
    }

    public static SearchBudget unbounded() {
        return new SearchBudget(UNBOUNDED, UNBOUNDED);
    }

    /**
     * Loads budget values from system properties.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(
                readBound(PROP_MAX_FRONTIER),
                readBound(PROP_MAX_EXPANSIONS)
        );
    }

    public int maxFrontierSize() {
        return maxFrontierSize;
    }

    public int maxExpansions() {
        return maxExpansions;
    }

    /**
     * Validates expanded label count against configured bound.
     */
    void checkExpansions(int expansions) {
        if (expansions > maxExpansions) {
            throw new BudgetExceededException(
                    REASON_EXPANSIONS_EXCEEDED,
                    "expansion budget exceeded: " + expansions + " > " + maxExpansions
            );
        }
    }

    /**
     * Validates frontier size against configured bound.
     */
    void checkFrontierSize(int frontierSize) {
        if (frontierSize > maxFrontierSize) {
            throw new BudgetExceededException(
                    REASON_FRONTIER_EXCEEDED,
                    "frontier budget exceeded: " + frontierSize + " > " + maxFrontierSize
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    private static int readBound(String property) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return UNBOUNDED;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return UNBOUNDED;
        }
    }

    @Override
    public String toString() {
        return "SearchBudget[maxFrontier=" + maxFrontierSize + ", maxExpansions=" + maxExpansions + "]";
    }

    /**
     * Deterministic exception for budget fail-fast paths. Fatal to the running candidate only.
     */
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super("[" + reasonCode + "] " + message);
            this.reasonCode = reasonCode;
        }

        public String reasonCode() {
            return reasonCode;
        }
    }
}
