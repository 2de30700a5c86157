package org.sweep.search;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("SearchBudget Tests")
class SearchBudgetTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(SearchBudget.PROP_MAX_EXPANSIONS);
        System.clearProperty(SearchBudget.PROP_MAX_FRONTIER);
    }

    @Test
    @DisplayName("Non-positive bounds normalize to unbounded")
    void testNormalization() {
        SearchBudget budget = SearchBudget.of(0, -5);
        assertEquals(SearchBudget.UNBOUNDED, budget.maxExpansions());
        assertEquals(SearchBudget.UNBOUNDED, budget.maxFrontierSize());
        assertDoesNotThrow(() -> budget.checkExpansions(Integer.MAX_VALUE));
    }

    @Test
    @DisplayName("Crossing a bound raises a reason-coded exception")
    void testBoundsEnforced() {
        SearchBudget budget = SearchBudget.of(10, 3);
        assertDoesNotThrow(() -> budget.checkExpansions(10));
        assertDoesNotThrow(() -> budget.checkFrontierSize(3));

        SearchBudget.BudgetExceededException expansions =
                assertThrows(SearchBudget.BudgetExceededException.class, () -> budget.checkExpansions(11));
        assertEquals(SearchBudget.REASON_EXPANSIONS_EXCEEDED, expansions.reasonCode());

        SearchBudget.BudgetExceededException frontier =
                assertThrows(SearchBudget.BudgetExceededException.class, () -> budget.checkFrontierSize(4));
        assertEquals(SearchBudget.REASON_FRONTIER_EXCEEDED, frontier.reasonCode());
    }

    @Test
    @DisplayName("Defaults are read from system properties")
    void testDefaultsFromProperties() {
        System.setProperty(SearchBudget.PROP_MAX_EXPANSIONS, " 250 ");
        System.setProperty(SearchBudget.PROP_MAX_FRONTIER, "40");

        SearchBudget budget = SearchBudget.defaults();
        assertEquals(250, budget.maxExpansions());
        assertEquals(40, budget.maxFrontierSize());
    }

    @Test
    @DisplayName("Missing or malformed properties fall back to unbounded")
    void testMalformedProperties() {
        System.setProperty(SearchBudget.PROP_MAX_EXPANSIONS, "lots");

        SearchBudget budget = SearchBudget.defaults();
        assertEquals(SearchBudget.UNBOUNDED, budget.maxExpansions());
        assertEquals(SearchBudget.UNBOUNDED, budget.maxFrontierSize());
        assertEquals(SearchBudget.UNBOUNDED, SearchBudget.unbounded().maxExpansions());
    }
}
