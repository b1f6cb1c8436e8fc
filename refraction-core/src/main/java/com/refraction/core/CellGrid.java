package com.refraction.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Mutable square grid of wall masks, refractors and goals. Used to materialize module faces
 * and as the working surface while a {@link Board} is assembled.
 */
public final class CellGrid {

    public static final int MODULE_SIZE = 8;

    private final int size;
    private final byte[] walls;
    private final Refractor[] refractors;
    private final Goal[] goals;

    public CellGrid(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Grid size must be at least 1");
        }
        this.size = size;
        this.walls = new byte[size * size];
        this.refractors = new Refractor[size * size];
        this.goals = new Goal[size * size];
    }

    public int size() {
        return size;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < size && y >= 0 && y < size;
    }

    /**
     * Sets a wall on one side of a single cell without touching its neighbour.
     */
    public void setWall(int x, int y, Side side) {
        int index = checkedIndex(x, y);
        walls[index] = (byte) (walls[index] | side.bit());
    }

    /**
     * Sets a wall and mirrors it onto the opposite side of the adjacent cell when that cell lies
     * inside this grid.
     */
    public void addWall(int x, int y, Side side) {
        setWall(x, y, side);
        int nx = x + side.dx();
        int ny = y + side.dy();
        if (contains(nx, ny)) {
            setWall(nx, ny, side.opposite());
        }
    }

    public boolean hasWall(int x, int y, Side side) {
        return (walls[checkedIndex(x, y)] & side.bit()) != 0;
    }

    public int wallMask(int x, int y) {
        return walls[checkedIndex(x, y)];
    }

    public void placeRefractor(Refractor refractor) {
        Objects.requireNonNull(refractor, "refractor");
        Position p = refractor.position();
        refractors[checkedIndex(p.x(), p.y())] = refractor;
    }

    public void placeGoal(Goal goal) {
        Objects.requireNonNull(goal, "goal");
        Position p = goal.position();
        goals[checkedIndex(p.x(), p.y())] = goal;
    }

    public Refractor refractorAt(int x, int y) {
        return refractors[checkedIndex(x, y)];
    }

    public Goal goalAt(int x, int y) {
        return goals[checkedIndex(x, y)];
    }

    /**
     * Removes any refractor and goal from the cell. Walls are kept.
     */
    public void clearContent(int x, int y) {
        int index = checkedIndex(x, y);
        refractors[index] = null;
        goals[index] = null;
    }

    public Cell cell(int x, int y) {
        int index = checkedIndex(x, y);
        return new Cell(new Position(x, y), walls[index], refractors[index], goals[index]);
    }

    public List<Goal> goals() {
        List<Goal> result = new ArrayList<>();
        for (Goal goal : goals) {
            if (goal != null) {
                result.add(goal);
            }
        }
        return result;
    }

    public List<Refractor> refractors() {
        List<Refractor> result = new ArrayList<>();
        for (Refractor refractor : refractors) {
            if (refractor != null) {
                result.add(refractor);
            }
        }
        return result;
    }

    /**
     * Returns a new grid where every wall, refractor and goal has been moved to its rotated
     * coordinate with its sides and diagonal rotated consistently.
     */
    public CellGrid rotated(Orientation orientation) {
        Objects.requireNonNull(orientation, "orientation");
        CellGrid result = new CellGrid(size);
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                int index = y * size + x;
                Position target = Rotation.rotatePoint(x, y, orientation, size);
                int targetIndex = target.y() * size + target.x();
                result.walls[targetIndex] = (byte) Rotation.rotateWallMask(walls[index], orientation);
                if (refractors[index] != null) {
                    result.placeRefractor(refractors[index].rotated(orientation, size));
                }
                if (goals[index] != null) {
                    result.placeGoal(goals[index].rotated(orientation, size));
                }
            }
        }
        return result;
    }

    /**
     * Returns {@code true} if both grids have identical walls, refractors and goals.
     */
    public boolean sameContent(CellGrid other) {
        if (other == null || other.size != size) {
            return false;
        }
        for (int i = 0; i < walls.length; i++) {
            if (walls[i] != other.walls[i]
                    || !Objects.equals(refractors[i], other.refractors[i])
                    || !Objects.equals(goals[i], other.goals[i])) {
                return false;
            }
        }
        return true;
    }

    private int checkedIndex(int x, int y) {
        if (!contains(x, y)) {
            throw new IllegalArgumentException("Coordinate out of range: (" + x + "," + y + ") for size " + size);
        }
        return y * size + x;
    }
}
