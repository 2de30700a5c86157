package org.sweep.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Per-search deterministic bounds on work and frontier growth.
 *
 * <p>The state space grows exponentially in the collectible count, so callers may cap
 * expansions (popped frontier entries) and live frontier size. Non-positive bounds mean
 * unbounded.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SearchBudget {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final String REASON_EXPANSIONS_EXCEEDED = "SEARCH_BUDGET_EXPANSIONS_EXCEEDED";
    public static final String REASON_FRONTIER_EXCEEDED = "SEARCH_BUDGET_FRONTIER_EXCEEDED";

    static final String PROP_MAX_EXPANSIONS = "sweep.search.maxExpansions";
    static final String PROP_MAX_FRONTIER = "sweep.search.maxFrontierSize";

    private final int maxExpansions;
    private final int maxFrontierSize;

    private SearchBudget(int maxExpansions, int maxFrontierSize) {
        this.maxExpansions = normalizeBound(maxExpansions);
        this.maxFrontierSize = normalizeBound(maxFrontierSize);
    }

    /**
     * Creates a budget with explicit bounds.
     */
    public static SearchBudget of(int maxExpansions, int maxFrontierSize) {
        return new SearchBudget(maxExpansions, maxFrontierSize);
    }

    /**
     * Creates a budget without limits.
     */
    public static SearchBudget unbounded() {
        return new SearchBudget(UNBOUNDED, UNBOUNDED);
    }

    /**
     * Loads budget values from system properties.
     */
    public static SearchBudget defaults() {
        return SearchBudget.of(
                readBound(PROP_MAX_EXPANSIONS),
                readBound(PROP_MAX_FRONTIER)
        );
    }

    /**
     * Validates the number of popped frontier entries.
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
     * Validates the live frontier size.
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

    /**
     * Deterministic exception for budget fail-fast paths.
     */
    @Getter
    @Accessors(fluent = true)
    public static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
