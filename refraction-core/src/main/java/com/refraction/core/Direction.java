package com.refraction.core;

/**
 * Slide direction. Declared in clockwise order so rotations are cyclic shifts.
 */
public enum Direction {
    UP(Side.TOP),
    RIGHT(Side.RIGHT),
    DOWN(Side.BOTTOM),
    LEFT(Side.LEFT);

    private static final Direction[] VALUES = values();

    private final Side side;

    Direction(Side side) {
        this.side = side;
    }

    /**
     * Returns the cell side a token leaves through when moving in this direction.
     */
    public Side side() {
        return side;
    }

    public int dx() {
        return side.dx();
    }

    public int dy() {
        return side.dy();
    }

    public Direction opposite() {
        return VALUES[(ordinal() + 2) & 3];
    }

    public Direction turned(int quarterTurns) {
        return VALUES[Math.floorMod(ordinal() + quarterTurns, VALUES.length)];
    }

    public static Direction fromTag(String tag) {
        return switch (tag.toLowerCase(java.util.Locale.ROOT)) {
            case "up", "u" -> UP;
            case "right", "r" -> RIGHT;
            case "down", "d" -> DOWN;
            case "left", "l" -> LEFT;
            default -> throw new IllegalArgumentException("Unknown direction: " + tag);
        };
    }
}
