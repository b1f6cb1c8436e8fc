package com.refraction.core;

/**
 * Cell side that may carry a wall. The declaration order is the clockwise cycle used by
 * {@link Rotation}; each side owns one bit of a cell's wall mask.
 */
public enum Side {
    TOP(0, -1),
    RIGHT(1, 0),
    BOTTOM(0, 1),
    LEFT(-1, 0);

    private static final Side[] VALUES = values();

    private final int dx;
    private final int dy;

    Side(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int dx() {
        return dx;
    }

    public int dy() {
        return dy;
    }

    /**
     * Returns the bit representing this side inside a wall mask.
     */
    public int bit() {
        return 1 << ordinal();
    }

    public Side opposite() {
        return VALUES[(ordinal() + 2) & 3];
    }

    /**
     * Returns the side reached after {@code quarterTurns} clockwise steps.
     */
    public Side turned(int quarterTurns) {
        return VALUES[Math.floorMod(ordinal() + quarterTurns, VALUES.length)];
    }

    public static Side fromTag(String tag) {
        return switch (tag) {
            case "top" -> TOP;
            case "right" -> RIGHT;
            case "bottom" -> BOTTOM;
            case "left" -> LEFT;
            default -> throw new IllegalArgumentException("Unknown wall side: " + tag);
        };
    }
}
