package com.refraction.core;

import java.util.Objects;

/**
 * Coordinate and attribute rotations for the four canonical {@link Orientation}s.
 * Rotations are clockwise in screen coordinates (x grows right, y grows down).
 */
public final class Rotation {

    private Rotation() {
    }

    /**
     * Rotates the point {@code (x, y)} inside a square coordinate system of side {@code size}.
     */
    public static Position rotatePoint(int x, int y, Orientation orientation, int size) {
        Objects.requireNonNull(orientation, "orientation");
        int max = size - 1;
        return switch (orientation) {
            case DEG_0 -> new Position(x, y);
            case DEG_90 -> new Position(max - y, x);
            case DEG_180 -> new Position(max - x, max - y);
            case DEG_270 -> new Position(y, max - x);
        };
    }

    public static Position rotatePoint(Position position, Orientation orientation, int size) {
        return rotatePoint(position.x(), position.y(), orientation, size);
    }

    public static Side rotateSide(Side side, Orientation orientation) {
        return side.turned(orientation.quarterTurns());
    }

    public static Direction rotateDirection(Direction direction, Orientation orientation) {
        return direction.turned(orientation.quarterTurns());
    }

    /**
     * Quarter turns swap the two diagonals, half turns keep them.
     */
    public static Diagonal rotateDiagonal(Diagonal diagonal, Orientation orientation) {
        return (orientation.quarterTurns() & 1) == 0 ? diagonal : diagonal.flipped();
    }

    /**
     * Returns a wall mask whose bits have been moved to their rotated sides.
     */
    public static int rotateWallMask(int mask, Orientation orientation) {
        int turns = orientation.quarterTurns();
        return ((mask << turns) | (mask >>> (4 - turns))) & 0xF;
    }
}
