package com.refraction.core;

import java.util.Objects;

/**
 * Movable colored marker at a position.
 */
public record Token(Color color, Position position) {

    public Token {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(position, "position");
        if (!color.isConcrete()) {
            throw new IllegalArgumentException("Token color must be concrete: " + color);
        }
    }

    @Override
    public String toString() {
        return color.tag() + position;
    }
}
