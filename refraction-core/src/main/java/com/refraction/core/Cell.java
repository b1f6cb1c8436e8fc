package com.refraction.core;

/**
 * Read-only view of one position of an assembled grid.
 *
 * @param position  the cell coordinate
 * @param walls     wall bit mask indexed by {@link Side#bit()}
 * @param refractor the refractor on this cell, or {@code null}
 * @param goal      the goal on this cell, or {@code null}
 */
public record Cell(Position position, int walls, Refractor refractor, Goal goal) {

    public boolean hasWall(Side side) {
        return (walls & side.bit()) != 0;
    }

    public boolean hasRefractor() {
        return refractor != null;
    }

    public boolean hasGoal() {
        return goal != null;
    }

    public boolean isEmpty() {
        return refractor == null && goal == null;
    }
}
