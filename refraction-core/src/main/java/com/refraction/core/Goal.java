package com.refraction.core;

import java.util.Objects;

/**
 * Goal cell marker. A goal with the {@link Color#WILDCARD} tag accepts any token.
 */
public record Goal(Position position, Shape shape, Color color, String id) {

    public Goal {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Goal id must not be blank");
        }
    }

    public boolean accepts(Color tokenColor) {
        return color.accepts(tokenColor);
    }

    public Goal movedTo(Position target) {
        return new Goal(target, shape, color, id);
    }

    public Goal rotated(Orientation orientation, int size) {
        return new Goal(Rotation.rotatePoint(position, orientation, size), shape, color, id);
    }
}
