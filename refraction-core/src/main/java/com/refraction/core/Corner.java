package com.refraction.core;

/**
 * Corner of a square tile, declared in clockwise order starting at the top-left.
 */
public enum Corner {
    TOP_LEFT,
    TOP_RIGHT,
    BOTTOM_RIGHT,
    BOTTOM_LEFT;

    private static final Corner[] VALUES = values();

    /**
     * Returns the corner cell of a tile with side {@code size}.
     */
    public Position position(int size) {
        int max = size - 1;
        return switch (this) {
            case TOP_LEFT -> new Position(0, 0);
            case TOP_RIGHT -> new Position(max, 0);
            case BOTTOM_RIGHT -> new Position(max, max);
            case BOTTOM_LEFT -> new Position(0, max);
        };
    }

    /**
     * Returns the clockwise rotation that carries this corner onto {@code target}.
     */
    public Orientation rotationTo(Corner target) {
        return Orientation.ofQuarterTurns(target.ordinal() - ordinal());
    }

    public Corner rotated(Orientation orientation) {
        return VALUES[(ordinal() + orientation.quarterTurns()) & 3];
    }

    public static Corner of(Position position, int size) {
        for (Corner corner : VALUES) {
            if (corner.position(size).equals(position)) {
                return corner;
            }
        }
        throw new IllegalArgumentException("Not a corner of a " + size + "x" + size + " tile: " + position);
    }
}
