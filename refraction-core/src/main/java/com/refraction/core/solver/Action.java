package com.refraction.core.solver;

import com.refraction.core.Color;
import com.refraction.core.Direction;
import com.refraction.core.Position;
import java.util.List;
import java.util.Objects;

/**
 * One counted step of a solution: a token's full slide, possibly spanning several refraction
 * segments.
 */
public record Action(Color token, Direction direction, Position from, Position to, List<Segment> segments) {

    public Action {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    @Override
    public String toString() {
        return token.tag() + " " + direction.name().toLowerCase(java.util.Locale.ROOT) + " " + from + " -> " + to;
    }
}
