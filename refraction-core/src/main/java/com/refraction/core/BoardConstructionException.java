package com.refraction.core;

import java.util.Objects;

/**
 * Fatal error raised when a board cannot be assembled from its configuration.
 */
public final class BoardConstructionException extends RuntimeException {

    private final Reason reason;

    public BoardConstructionException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        UNKNOWN_MODULE,
        UNKNOWN_FACE,
        DUPLICATE_COLOR,
        COLOR_COUNT,
        DUPLICATE_GOAL_ID
    }
}
