package com.refraction.core.solver;

/**
 * Outcome reported by a {@link Searcher}.
 */
public enum SearchStatus {
    SOLVED,
    TARGET_NOT_FOUND,
    INVALID_GOAL,
    INVALID_TOKEN_PLACEMENT,
    SEARCH_SPACE_EXHAUSTED,
    NO_PATH;

    public boolean isSuccess() {
        return this == SOLVED;
    }
}
