package com.refraction.core.module;

import com.refraction.core.Position;
import com.refraction.core.Side;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Authored wall record: the blocked sides of one cell in module coordinates.
 */
public record WallSpec(Position position, Set<Side> sides) {

    public WallSpec {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(sides, "sides");
        sides = sides.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Side.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(sides));
    }

    public static WallSpec of(int x, int y, Side first, Side... rest) {
        return new WallSpec(new Position(x, y), EnumSet.of(first, rest));
    }
}
