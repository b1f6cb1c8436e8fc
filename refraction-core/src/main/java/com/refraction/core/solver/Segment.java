package com.refraction.core.solver;

import com.refraction.core.Direction;
import com.refraction.core.Position;

/**
 * Straight part of a slide between two refractions.
 */
public record Segment(Position start, Direction direction, Position end) {
}
