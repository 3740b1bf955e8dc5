package org.paneltwin.routing.search;

/**
 * Why a wire could not be routed. Returned inside {@link PathResult}, never thrown.
 */
public enum UnroutableReason {
    /** Start or goal lies outside the grid. */
    OUT_OF_BOUNDS,
    /** Open set exhausted without reaching the goal. */
    NO_PATH,
    /** Expanded-cell budget was hit before the search finished. */
    SEARCH_LIMIT_EXCEEDED,
    /** Start or goal cell is blocked. */
    ENDPOINT_BLOCKED;

    /**
     * Returns whether a caller that only distinguishes "no path" should treat this reason as one.
     */
    public boolean isEffectivelyNoPath() {
        return switch (this) {
            case NO_PATH, SEARCH_LIMIT_EXCEEDED -> true;
            case OUT_OF_BOUNDS, ENDPOINT_BLOCKED -> false;
        };
    }
}
