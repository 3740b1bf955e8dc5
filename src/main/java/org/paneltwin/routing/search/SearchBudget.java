package org.paneltwin.routing.search;

import org.paneltwin.config.RoutingConfig;

/**
 * Per-query bound on cells expanded by one search.
 */
final class SearchBudget {
    static final int UNBOUNDED = Integer.MAX_VALUE;

    static final String REASON_EXPANDED_EXCEEDED = "SEARCH_BUDGET_EXPANDED_EXCEEDED";

    private final int maxExpandedCells;

    private SearchBudget(int maxExpandedCells) {
        this.maxExpandedCells = normalizeBound(maxExpandedCells);
    }

    /**
     * Creates a budget with an explicit bound; values {@code <= 0} mean unbounded.
     */
    static SearchBudget of(int maxExpandedCells) {
        return new SearchBudget(maxExpandedCells);
    }

    static SearchBudget from(RoutingConfig config) {
        return of(config.getMaxExpandedCells());
    }

    int maxExpandedCells() {
        return maxExpandedCells;
    }

    /**
     * Validates the number of expanded cells against the configured bound.
     */
    void checkExpandedCells(int expandedCells) {
        if (expandedCells > maxExpandedCells) {
            throw new BudgetExceededException(
                    REASON_EXPANDED_EXCEEDED,
                    "expanded-cell budget exceeded: " + expandedCells + " > " + maxExpandedCells
            );
        }
    }

    private static int normalizeBound(int bound) {
        if (bound <= 0) {
            return UNBOUNDED;
        }
        return bound;
    }

    /**
     * Fail-fast signal raised inside the search loop and converted to a result by the engine.
     */
    static final class BudgetExceededException extends RuntimeException {
        private final String reasonCode;

        BudgetExceededException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }

        String reasonCode() {
            return reasonCode;
        }
    }
}
