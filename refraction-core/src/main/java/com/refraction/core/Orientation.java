package com.refraction.core;

/**
 * One of the four canonical clockwise rotation angles. Orientations compose by addition
 * modulo 360 degrees.
 */
public enum Orientation {
    DEG_0,
    DEG_90,
    DEG_180,
    DEG_270;

    private static final Orientation[] VALUES = values();

    public int degrees() {
        return ordinal() * 90;
    }

    public int quarterTurns() {
        return ordinal();
    }

    public Orientation plus(Orientation other) {
        return VALUES[(ordinal() + other.ordinal()) & 3];
    }

    /**
     * Returns the orientation that undoes this one.
     */
    public Orientation inverse() {
        return VALUES[(4 - ordinal()) & 3];
    }

    public static Orientation ofQuarterTurns(int quarterTurns) {
        return VALUES[Math.floorMod(quarterTurns, VALUES.length)];
    }

    public static Orientation fromDegrees(int degrees) {
        return switch (degrees) {
            case 0 -> DEG_0;
            case 90 -> DEG_90;
            case 180 -> DEG_180;
            case 270 -> DEG_270;
            default -> throw new IllegalArgumentException("Invalid rotation angle: " + degrees);
        };
    }
}
