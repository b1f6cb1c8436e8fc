package com.refraction.core;

import java.util.Objects;

/**
 * Colored diagonal cell. Tokens of the same color pass straight through, all other tokens
 * are deflected by 90 degrees.
 */
public record Refractor(Position position, Diagonal diagonal, Color color) {

    public Refractor {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(diagonal, "diagonal");
        Objects.requireNonNull(color, "color");
        if (!color.isConcrete()) {
            throw new IllegalArgumentException("Refractor color must be concrete: " + color);
        }
    }

    public boolean isTransparentTo(Color tokenColor) {
        return color == tokenColor;
    }

    /**
     * Returns the direction a token of {@code tokenColor} moving in {@code incoming} leaves
     * this cell with.
     */
    public Direction deflect(Direction incoming, Color tokenColor) {
        return isTransparentTo(tokenColor) ? incoming : diagonal.deflect(incoming);
    }

    public Refractor movedTo(Position target) {
        return new Refractor(target, diagonal, color);
    }

    public Refractor rotated(Orientation orientation, int size) {
        return new Refractor(Rotation.rotatePoint(position, orientation, size),
                Rotation.rotateDiagonal(diagonal, orientation), color);
    }
}
