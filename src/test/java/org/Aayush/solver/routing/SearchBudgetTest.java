package org.Aayush.solver.routing;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SearchBudgetTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(SearchBudget.PROP_MAX_FRONTIER);
        System.clearProperty(SearchBudget.PROP_MAX_EXPANSIONS);
    }

    @Test
    @DisplayName("Bounds: non-positive values mean unbounded")
    void testNormalization() {
        SearchBudget budget = SearchBudget.of(0, -5);

        assertEquals(SearchBudget.UNBOUNDED, budget.maxFrontierSize());
        assertEquals(SearchBudget.UNBOUNDED, budget.maxExpansions());
        assertDoesNotThrow(() -> budget.checkExpansions(1_000_000));
    }

    @Test
    @DisplayName("Fail-fast: checks throw reason-coded exceptions past the bound")
    void testChecks() {
        SearchBudget budget = SearchBudget.of(2, 3);

        assertDoesNotThrow(() -> budget.checkFrontierSize(2));
        SearchBudget.BudgetExceededException frontier = assertThrows(
                SearchBudget.BudgetExceededException.class, () -> budget.checkFrontierSize(3));
        assertEquals(SearchBudget.REASON_FRONTIER_EXCEEDED, frontier.reasonCode());
        assertTrue(frontier.getMessage().startsWith("[SEARCH_FRONTIER_EXCEEDED]"));
        SearchBudget.BudgetExceededException expansions = assertThrows(
                SearchBudget.BudgetExceededException.class, () -> budget.checkExpansions(4));
        assertEquals(SearchBudget.REASON_EXPANSIONS_EXCEEDED, expansions.reasonCode());
    }

    @Test
    @DisplayName("System properties: parsed when valid, unbounded when malformed")
    void testDefaultsFromProperties() {
        System.setProperty(SearchBudget.PROP_MAX_FRONTIER, " 128 ");
        System.setProperty(SearchBudget.PROP_MAX_EXPANSIONS, "not-a-number");

        SearchBudget budget = SearchBudget.defaults();

        assertEquals(128, budget.maxFrontierSize());
        assertEquals(SearchBudget.UNBOUNDED, budget.maxExpansions());
    }
}
