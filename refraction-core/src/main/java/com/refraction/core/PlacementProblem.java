package com.refraction.core;

/**
 * A token position that is not allowed at the start of a game.
 */
public record PlacementProblem(Kind kind, Color color, Position position) {

    public enum Kind {
        OFF_BOARD,
        DEAD_ZONE,
        ON_REFRACTOR,
        OVERLAP
    }

    public String describe() {
        return switch (kind) {
            case OFF_BOARD -> color.tag() + " token is outside the board at " + position;
            case DEAD_ZONE -> color.tag() + " token is inside the central dead zone at " + position;
            case ON_REFRACTOR -> color.tag() + " token cannot start on a refractor at " + position;
            case OVERLAP -> color.tag() + " token shares " + position + " with another token";
        };
    }
}
