package com.refraction.core.solver;

import com.refraction.core.Board;
import com.refraction.core.Color;
import com.refraction.core.Direction;
import com.refraction.core.Position;
import com.refraction.core.Refractor;
import com.refraction.core.Token;
import com.refraction.core.TokenLayout;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Computes the full slide of a single token, including refraction chains.
 *
 * <p>A token advances cell by cell until the board edge, the dead zone, a wall on its current
 * cell or another token stops it. Landing on a refractor of a different color turns the token
 * and starts a new segment; refractors of its own color are passed straight through. A
 * repeated (cell, direction) pair after a turn ends the slide on that cell.
 *
 * <p>Instances keep a scratch buffer for cycle detection and must not be shared between
 * threads. The {@link Board} itself may be shared freely.
 */
public final class MoveSimulator {

    /**
     * Order in which directions are tried when enumerating moves.
     */
    public static final List<Direction> SEARCH_ORDER =
            List.of(Direction.UP, Direction.DOWN, Direction.LEFT, Direction.RIGHT);

    private static final int DIRECTION_COUNT = 4;

    private final Board board;
    private final int[] seen = new int[Board.CELL_COUNT * DIRECTION_COUNT];
    private int generation;

    public MoveSimulator(Board board) {
        this.board = Objects.requireNonNull(board, "board");
    }

    public Board board() {
        return board;
    }

    /**
     * Simulates the token of {@code color} standing on {@code start} sliding in
     * {@code direction}. Every other token of {@code layout} is an obstacle; an entry of the
     * same color in the layout is ignored.
     */
    public MoveResult simulate(Color color, Position start, Direction direction, TokenLayout layout) {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(layout, "layout");
        if (!board.isValidPosition(start)) {
            throw new IllegalArgumentException("Token start is not a valid cell: " + start);
        }

        int[] cells = new int[layout.size() + 1];
        int count = 0;
        cells[count++] = start.index();
        for (Token token : layout.tokens()) {
            if (token.color() != color) {
                cells[count++] = token.position().index();
            }
        }

        List<Segment> segments = new ArrayList<>();
        int finalCell = slide(cells, count, 0, color, direction, segments);
        return new MoveResult(finalCell != cells[0], Position.ofIndex(finalCell), segments);
    }

    /**
     * Simulates the token of {@code color} in {@code layout}.
     */
    public MoveResult simulate(Color color, Direction direction, TokenLayout layout) {
        Position start = layout.positionOf(color)
                .orElseThrow(() -> new IllegalArgumentException("No " + color.tag() + " token in layout"));
        return simulate(color, start, direction, layout);
    }

    /**
     * Returns every action of the token of {@code color} that displaces it.
     */
    public List<Action> possibleMoves(TokenLayout layout, Color color) {
        Position start = layout.positionOf(color)
                .orElseThrow(() -> new IllegalArgumentException("No " + color.tag() + " token in layout"));
        List<Action> actions = new ArrayList<>();
        for (Direction direction : SEARCH_ORDER) {
            MoveResult result = simulate(color, start, direction, layout);
            if (result.moved()) {
                actions.add(new Action(color, direction, start, result.finalPosition(), result.segments()));
            }
        }
        return actions;
    }

    /**
     * Allocation-free slide over packed cell indices.
     *
     * @param cells      row-major cell index of every token
     * @param count      number of valid entries in {@code cells}
     * @param tokenIndex slot of the moving token
     * @param color      color of the moving token
     * @param direction  requested direction
     * @param segments   receives the travelled segments, or {@code null} to skip recording
     * @return the cell index the token comes to rest on
     */
    int slide(int[] cells, int count, int tokenIndex, Color color, Direction direction, List<Segment> segments) {
        nextGeneration();
        int current = cells[tokenIndex];
        Direction heading = direction;
        int segmentStart = current;
        Direction segmentDirection = heading;

        while (true) {
            int next = step(current, heading, cells, count, tokenIndex);
            if (next < 0) {
                break;
            }
            current = next;
            Refractor refractor = board.refractorAt(current);
            if (refractor == null || refractor.isTransparentTo(color)) {
                continue;
            }
            Direction deflected = refractor.diagonal().deflect(heading);
            if (segments != null) {
                segments.add(new Segment(Position.ofIndex(segmentStart), segmentDirection, Position.ofIndex(current)));
            }
            segmentStart = current;
            segmentDirection = deflected;
            int key = current * DIRECTION_COUNT + deflected.ordinal();
            if (seen[key] == generation) {
                break;
            }
            seen[key] = generation;
            heading = deflected;
        }

        if (segments != null && current != segmentStart) {
            segments.add(new Segment(Position.ofIndex(segmentStart), segmentDirection, Position.ofIndex(current)));
        }
        return current;
    }

    private int step(int current, Direction heading, int[] cells, int count, int tokenIndex) {
        if ((board.wallMask(current) & heading.side().bit()) != 0) {
            return -1;
        }
        int nx = current % Board.SIZE + heading.dx();
        int ny = current / Board.SIZE + heading.dy();
        if (!Board.isInside(nx, ny) || Board.isInDeadZone(nx, ny)) {
            return -1;
        }
        int next = ny * Board.SIZE + nx;
        for (int i = 0; i < count; i++) {
            if (i != tokenIndex && cells[i] == next) {
                return -1;
            }
        }
        return next;
    }

    private void nextGeneration() {
        generation++;
        if (generation == 0) {
            Arrays.fill(seen, 0);
            generation = 1;
        }
    }
}
