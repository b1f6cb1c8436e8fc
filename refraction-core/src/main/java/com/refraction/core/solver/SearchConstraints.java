package com.refraction.core.solver;

/**
 * Immutable search configuration passed to {@link Searcher} implementations.
 *
 * @param stateLimit maximum number of states dequeued before the search gives up
 */
public record SearchConstraints(long stateLimit) {

    public static final long DEFAULT_STATE_LIMIT = 1_000_000L;

    private static final SearchConstraints DEFAULTS = new SearchConstraints(DEFAULT_STATE_LIMIT);

    public SearchConstraints {
        if (stateLimit < 1) {
            throw new IllegalArgumentException("stateLimit must be at least 1");
        }
    }

    public static SearchConstraints defaults() {
        return DEFAULTS;
    }
}
