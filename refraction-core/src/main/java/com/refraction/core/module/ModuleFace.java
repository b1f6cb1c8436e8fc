package com.refraction.core.module;

import com.refraction.core.CellGrid;
import com.refraction.core.Goal;
import com.refraction.core.Position;
import com.refraction.core.Refractor;
import com.refraction.core.Side;
import java.util.List;
import java.util.Objects;

/**
 * One side of a module tile. All coordinates are in the module's own unrotated 8x8 space.
 */
public record ModuleFace(List<WallSpec> walls, List<Refractor> refractors, List<Goal> goals) {

    public ModuleFace {
        Objects.requireNonNull(walls, "walls");
        Objects.requireNonNull(refractors, "refractors");
        Objects.requireNonNull(goals, "goals");
        walls = List.copyOf(walls);
        refractors = List.copyOf(refractors);
        goals = List.copyOf(goals);
        for (WallSpec wall : walls) {
            checkInside(wall.position());
        }
        for (Refractor refractor : refractors) {
            checkInside(refractor.position());
        }
        for (Goal goal : goals) {
            checkInside(goal.position());
        }
    }

    /**
     * Builds the unrotated grid of this face. Only the listed walls are set, each mirrored onto
     * its neighbour inside the tile; no perimeter walls are implied.
     */
    public CellGrid materialize() {
        CellGrid grid = new CellGrid(CellGrid.MODULE_SIZE);
        for (WallSpec wall : walls) {
            for (Side side : wall.sides()) {
                grid.addWall(wall.position().x(), wall.position().y(), side);
            }
        }
        for (Refractor refractor : refractors) {
            grid.placeRefractor(refractor);
        }
        for (Goal goal : goals) {
            grid.placeGoal(goal);
        }
        return grid;
    }

    private static void checkInside(Position position) {
        if (!position.isInside(CellGrid.MODULE_SIZE)) {
            throw new IllegalArgumentException("Module coordinate out of range: " + position);
        }
    }
}
