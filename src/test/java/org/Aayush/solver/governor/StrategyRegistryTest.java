package org.Aayush.solver.governor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrategyRegistryTest {

    @Test
    @DisplayName("Built-ins are registered in tie-break order")
    void testBuiltInOrder() {
        StrategyRegistry registry = new StrategyRegistry(3);

        assertEquals(List.of(
                StrategyRegistry.STRATEGY_MATCH_THEN_ROUTE,
                StrategyRegistry.STRATEGY_MATCH_THEN_ROUTE_UNSPLIT,
                StrategyRegistry.STRATEGY_MATCH_THEN_DIRECT
        ), List.copyOf(registry.strategyIds()));
        SolveStrategy direct = registry.strategy(StrategyRegistry.STRATEGY_MATCH_THEN_DIRECT);
        assertEquals(1, direct.getMaxHops());
        assertTrue(direct.isPeerMatching());
        assertFalse(direct.isSplitting());
        SolveStrategy unsplit = registry.strategy(StrategyRegistry.STRATEGY_MATCH_THEN_ROUTE_UNSPLIT);
        assertEquals(3, unsplit.getMaxHops());
        assertFalse(unsplit.isSplitting());
        for (SolveStrategy strategy : registry.strategies()) {
            assertTrue(strategy.isPeerMatching(), strategy.getId());
        }
    }

    @Test
    @DisplayName("Custom strategies append after built-ins and override by id in place")
    void testMergeWithCustom() {
        SolveStrategy deep = SolveStrategy.builder().id("DEEP").maxHops(5).splitting(true).build();
        SolveStrategy override = SolveStrategy.builder().id(StrategyRegistry.STRATEGY_MATCH_THEN_ROUTE_UNSPLIT).maxHops(2).build();

        StrategyRegistry registry = new StrategyRegistry(3, List.of(deep, override));

        assertEquals(4, registry.strategies().size());
        assertEquals(StrategyRegistry.STRATEGY_MATCH_THEN_ROUTE_UNSPLIT, registry.strategies().get(1).getId());
        assertEquals(2, registry.strategy(StrategyRegistry.STRATEGY_MATCH_THEN_ROUTE_UNSPLIT).getMaxHops());
        assertEquals("DEEP", registry.strategies().get(3).getId());
        assertTrue(registry.strategy("DEEP").isPeerMatching());
    }

    @Test
    @DisplayName("Explicit registry without built-ins keeps only the provided strategies")
    void testExplicitOnly() {
        SolveStrategy only = SolveStrategy.builder().id("ONLY").maxHops(1).build();

        StrategyRegistry registry = new StrategyRegistry(List.of(only), false, 3);

        assertEquals(List.of("ONLY"), List.copyOf(registry.strategyIds()));
        assertNull(registry.strategy(StrategyRegistry.STRATEGY_MATCH_THEN_ROUTE_UNSPLIT));
        assertNull(registry.strategy(null));
    }

    @Test
    @DisplayName("Validation: empty registry, blank id and non-positive hops are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new StrategyRegistry(List.of(), false, 3));
        assertThrows(IllegalArgumentException.class,
                () -> new StrategyRegistry(3, List.of(SolveStrategy.builder().id(" ").maxHops(1).build())));
        assertThrows(IllegalArgumentException.class,
                () -> new StrategyRegistry(3, List.of(SolveStrategy.builder().id("X").maxHops(0).build())));
        assertThrows(UnsupportedOperationException.class,
                () -> new StrategyRegistry(3).strategyIds().clear());
    }
}
