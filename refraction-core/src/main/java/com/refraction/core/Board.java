package com.refraction.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable 16x16 composite board. Every cell carries a wall bit mask, at most one
 * {@link Refractor} and at most one {@link Goal}. The outer boundary is always walled and the
 * central 2x2 dead zone is always sealed and empty.
 *
 * <p>Boards are read-only once built and may be shared by concurrent searches.
 */
public final class Board {

    public static final int SIZE = 16;
    public static final int CELL_COUNT = SIZE * SIZE;
    public static final int DEAD_ZONE_MIN = 7;
    public static final int DEAD_ZONE_MAX = 8;

    private final byte[] walls;
    private final Refractor[] refractors;
    private final Goal[] goalsByCell;
    private final List<Goal> goals;
    private final BoardConfiguration configuration;

    private Board(CellGrid grid, BoardConfiguration configuration) {
        this.walls = new byte[CELL_COUNT];
        this.refractors = new Refractor[CELL_COUNT];
        this.goalsByCell = new Goal[CELL_COUNT];
        List<Goal> collected = new ArrayList<>();
        for (int y = 0; y < SIZE; y++) {
            for (int x = 0; x < SIZE; x++) {
                int index = y * SIZE + x;
                walls[index] = (byte) grid.wallMask(x, y);
                refractors[index] = grid.refractorAt(x, y);
                Goal goal = grid.goalAt(x, y);
                goalsByCell[index] = goal;
                if (goal != null) {
                    collected.add(goal);
                }
            }
        }
        this.goals = Collections.unmodifiableList(collected);
        this.configuration = configuration;
    }

    /**
     * Returns a builder for a board assembled cell by cell.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a board that has only the outer boundary and the sealed dead zone.
     */
    public static Board empty() {
        return builder().build();
    }

    public static boolean isInside(int x, int y) {
        return x >= 0 && x < SIZE && y >= 0 && y < SIZE;
    }

    public static boolean isInDeadZone(int x, int y) {
        return x >= DEAD_ZONE_MIN && x <= DEAD_ZONE_MAX && y >= DEAD_ZONE_MIN && y <= DEAD_ZONE_MAX;
    }

    public static boolean isInDeadZone(Position position) {
        return isInDeadZone(position.x(), position.y());
    }

    /**
     * Returns {@code true} if the position lies on the board and outside the dead zone.
     */
    public boolean isValidPosition(Position position) {
        return position != null && isInside(position.x(), position.y()) && !isInDeadZone(position);
    }

    public Cell cell(int x, int y) {
        int index = checkedIndex(x, y);
        return new Cell(new Position(x, y), walls[index], refractors[index], goalsByCell[index]);
    }

    public Cell cell(Position position) {
        return cell(position.x(), position.y());
    }

    public boolean hasWall(int x, int y, Side side) {
        return (walls[checkedIndex(x, y)] & side.bit()) != 0;
    }

    public boolean hasWall(Position position, Side side) {
        return hasWall(position.x(), position.y(), side);
    }

    /**
     * Returns the wall mask of the cell with the provided row-major index.
     */
    public int wallMask(int cellIndex) {
        return walls[cellIndex];
    }

    /**
     * Returns the refractor on the cell with the provided row-major index, or {@code null}.
     */
    public Refractor refractorAt(int cellIndex) {
        return refractors[cellIndex];
    }

    public Optional<Refractor> refractorAt(Position position) {
        return Optional.ofNullable(refractors[checkedIndex(position.x(), position.y())]);
    }

    public Optional<Goal> goalAt(Position position) {
        return Optional.ofNullable(goalsByCell[checkedIndex(position.x(), position.y())]);
    }

    public List<Goal> goals() {
        return goals;
    }

    public Optional<Goal> goalById(String id) {
        for (Goal goal : goals) {
            if (goal.id().equals(id)) {
                return Optional.of(goal);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the goals a token of the provided color may finish on.
     */
    public List<Goal> goalsFor(Color tokenColor) {
        List<Goal> result = new ArrayList<>();
        for (Goal goal : goals) {
            if (goal.accepts(tokenColor)) {
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

    public int refractorCount() {
        int count = 0;
        for (Refractor refractor : refractors) {
            if (refractor != null) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns the number of distinct wall segments. A wall shared by two cells counts once.
     */
    public int wallCount() {
        int sides = 0;
        int boundary = 0;
        for (int y = 0; y < SIZE; y++) {
            for (int x = 0; x < SIZE; x++) {
                int mask = walls[y * SIZE + x];
                sides += Integer.bitCount(mask);
                for (Side side : Side.values()) {
                    if ((mask & side.bit()) != 0 && !isInside(x + side.dx(), y + side.dy())) {
                        boundary++;
                    }
                }
            }
        }
        return (sides - boundary) / 2 + boundary;
    }

    /**
     * Returns the quadrant configuration this board was assembled from, if any.
     */
    public Optional<BoardConfiguration> configuration() {
        return Optional.ofNullable(configuration);
    }

    private static int checkedIndex(int x, int y) {
        if (!isInside(x, y)) {
            throw new IllegalArgumentException("Coordinate out of range: (" + x + "," + y + ")");
        }
        return y * SIZE + x;
    }

    /**
     * Mutable assembly surface. The outer boundary is walled on creation, {@link #build()}
     * seals the dead zone and indexes the goals.
     */
    public static final class Builder {

        private final CellGrid grid = new CellGrid(SIZE);
        private BoardConfiguration configuration;

        private Builder() {
            for (int i = 0; i < SIZE; i++) {
                grid.setWall(i, 0, Side.TOP);
                grid.setWall(i, SIZE - 1, Side.BOTTOM);
                grid.setWall(0, i, Side.LEFT);
                grid.setWall(SIZE - 1, i, Side.RIGHT);
            }
        }

        /**
         * Adds a wall and its mirror on the neighbouring cell. Walls on the true outer boundary
         * are already present and are skipped.
         */
        public Builder wall(int x, int y, Side side) {
            Objects.requireNonNull(side, "side");
            if (!isOuterBoundary(x, y, side)) {
                grid.addWall(x, y, side);
            }
            return this;
        }

        public Builder wall(Position position, Side... sides) {
            for (Side side : sides) {
                wall(position.x(), position.y(), side);
            }
            return this;
        }

        public Builder refractor(Refractor refractor) {
            grid.placeRefractor(refractor);
            return this;
        }

        public Builder refractor(int x, int y, Diagonal diagonal, Color color) {
            return refractor(new Refractor(new Position(x, y), diagonal, color));
        }

        public Builder goal(Goal goal) {
            grid.placeGoal(goal);
            return this;
        }

        public Builder configuration(BoardConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        /**
         * Seals the dead zone, verifies goal ids are unique and returns the immutable board.
         */
        public Board build() {
            sealDeadZone();
            Set<String> ids = new HashSet<>();
            for (Goal goal : grid.goals()) {
                if (!ids.add(goal.id())) {
                    throw new BoardConstructionException(BoardConstructionException.Reason.DUPLICATE_GOAL_ID,
                            "Duplicate goal id: " + goal.id());
                }
            }
            return new Board(grid, configuration);
        }

        private void sealDeadZone() {
            for (int y = DEAD_ZONE_MIN; y <= DEAD_ZONE_MAX; y++) {
                for (int x = DEAD_ZONE_MIN; x <= DEAD_ZONE_MAX; x++) {
                    for (Side side : Side.values()) {
                        grid.setWall(x, y, side);
                    }
                    grid.clearContent(x, y);
                }
            }
            for (int i = DEAD_ZONE_MIN; i <= DEAD_ZONE_MAX; i++) {
                grid.setWall(DEAD_ZONE_MIN - 1, i, Side.RIGHT);
                grid.setWall(DEAD_ZONE_MAX + 1, i, Side.LEFT);
                grid.setWall(i, DEAD_ZONE_MIN - 1, Side.BOTTOM);
                grid.setWall(i, DEAD_ZONE_MAX + 1, Side.TOP);
            }
        }

        private static boolean isOuterBoundary(int x, int y, Side side) {
            return (side == Side.TOP && y == 0)
                    || (side == Side.BOTTOM && y == SIZE - 1)
                    || (side == Side.LEFT && x == 0)
                    || (side == Side.RIGHT && x == SIZE - 1);
        }
    }
}
