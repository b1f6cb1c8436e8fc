package com.refraction.core.solver;

import com.refraction.core.Position;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of simulating one slide request.
 *
 * @param moved         {@code true} if the token ended somewhere other than where it started
 * @param finalPosition the cell the token comes to rest on
 * @param segments      the straight segments travelled, in order
 */
public record MoveResult(boolean moved, Position finalPosition, List<Segment> segments) {

    public MoveResult {
        Objects.requireNonNull(finalPosition, "finalPosition");
        segments = segments == null ? List.of() : List.copyOf(segments);
    }
}
