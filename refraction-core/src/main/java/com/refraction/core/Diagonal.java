package com.refraction.core;

/**
 * Orientation of a refractor's mirror line.
 */
public enum Diagonal {
    /** Top-left to bottom-right. */
    BACKSLASH("\\"),
    /** Bottom-left to top-right. */
    SLASH("/");

    private final String symbol;

    Diagonal(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public Diagonal flipped() {
        return this == BACKSLASH ? SLASH : BACKSLASH;
    }

    /**
     * Returns the direction a deflected token continues in after entering while moving in
     * {@code incoming}.
     */
    public Direction deflect(Direction incoming) {
        if (this == BACKSLASH) {
            return switch (incoming) {
                case RIGHT -> Direction.DOWN;
                case DOWN -> Direction.RIGHT;
                case LEFT -> Direction.UP;
                case UP -> Direction.LEFT;
            };
        }
        return switch (incoming) {
            case RIGHT -> Direction.UP;
            case UP -> Direction.RIGHT;
            case LEFT -> Direction.DOWN;
            case DOWN -> Direction.LEFT;
        };
    }

    public static Diagonal fromSymbol(String symbol) {
        return switch (symbol.trim()) {
            case "\\" -> BACKSLASH;
            case "/" -> SLASH;
            default -> throw new IllegalArgumentException("Invalid refractor orientation: " + symbol);
        };
    }
}
