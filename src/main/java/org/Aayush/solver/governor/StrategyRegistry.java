package org.Aayush.solver.governor;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, ordered registry of candidate strategies.
 *
 * <p>Registration order is significant: it is the tie-break order when two candidates reach the
 * same score. A custom strategy reusing a built-in id replaces the built-in in place.</p>
 */
public final class StrategyRegistry {
    public static final String STRATEGY_MATCH_THEN_ROUTE = "MATCH_THEN_ROUTE";
    public static final String STRATEGY_MATCH_THEN_ROUTE_UNSPLIT = "MATCH_THEN_ROUTE_UNSPLIT";
    public static final String STRATEGY_MATCH_THEN_DIRECT = "MATCH_THEN_DIRECT";

    private final Map<String, SolveStrategy> strategiesById;

    /**
     * Creates a registry with built-in strategies only.
     *
     * @param maxHops hop limit of the routing built-ins.
     */
    public StrategyRegistry(int maxHops) {
        this.strategiesById = freeze(materialize(builtIns(maxHops)));
    }

    /**
     * Creates a registry by merging built-ins with custom strategies.
     */
    public StrategyRegistry(int maxHops, Collection<SolveStrategy> customStrategies) {
        this.strategiesById = freeze(mergeWithBuiltIns(maxHops, customStrategies));
    }

    /**
     * Creates an explicit registry from provided strategies.
     */
    public StrategyRegistry(Collection<SolveStrategy> strategies, boolean includeBuiltIns, int maxHops) {
        this.strategiesById = includeBuiltIns
                ? freeze(mergeWithBuiltIns(maxHops, strategies))
                : freeze(materialize(strategies));
    }

    /**
     * Returns strategy by id, or null when not registered.
     */
    public SolveStrategy strategy(String strategyId) {
        if (strategyId == null) {
            return null;
        }
        return strategiesById.get(strategyId);
    }

    /**
     * Returns registered ids in registration order.
     */
    public Set<String> strategyIds() {
        return strategiesById.keySet();
    }

    /**
     * Returns registered strategies in registration order.
     */
    public List<SolveStrategy> strategies() {
        return List.copyOf(strategiesById.values());
    }

    /**
     * Built-in strategies in tie-break order. All of them match peers before routing and differ
     * only in hop limit and splitting.
     */
    public static List<SolveStrategy> builtIns(int maxHops) {
        return List.of(
                SolveStrategy.builder().id(STRATEGY_MATCH_THEN_ROUTE).maxHops(maxHops).peerMatching(true).splitting(true).build(),
                SolveStrategy.builder().id(STRATEGY_MATCH_THEN_ROUTE_UNSPLIT).maxHops(maxHops).peerMatching(true).splitting(false).build(),
                SolveStrategy.builder().id(STRATEGY_MATCH_THEN_DIRECT).maxHops(1).peerMatching(true).splitting(false).build()
        );
    }

    private static LinkedHashMap<String, SolveStrategy> mergeWithBuiltIns(int maxHops, Collection<SolveStrategy> customStrategies) {
        LinkedHashMap<String, SolveStrategy> merged = materialize(builtIns(maxHops));
        if (customStrategies != null) {
            merged.putAll(materialize(customStrategies));
        }
        return merged;
    }

    private static LinkedHashMap<String, SolveStrategy> materialize(Collection<SolveStrategy> strategies) {
        Objects.requireNonNull(strategies, "strategies");
        LinkedHashMap<String, SolveStrategy> map = new LinkedHashMap<>();
        for (SolveStrategy strategy : strategies) {
            SolveStrategy nonNullStrategy = Objects.requireNonNull(strategy, "strategy").validate();
            map.put(nonNullStrategy.getId().trim(), nonNullStrategy);
        }
        return map;
    }

    private static Map<String, SolveStrategy> freeze(LinkedHashMap<String, SolveStrategy> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("at least one strategy must be registered");
        }
        return Collections.unmodifiableMap(strategies);
    }
}
