package com.refraction.core.solver;

import com.refraction.core.Board;
import com.refraction.core.Color;
import com.refraction.core.Direction;
import com.refraction.core.Position;
import com.refraction.core.TokenLayout;
import com.refraction.core.solver.state.JointState;
import com.refraction.core.solver.state.SearchFrontier;
import com.refraction.core.solver.state.VisitedStates;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Breadth-first search over joint token states.
 *
 * <p>From every state each token is tried in color order and each direction in
 * {@link MoveSimulator#SEARCH_ORDER}. Slides without displacement are skipped. When the target
 * token lands on the goal the transition wins, provided the path is at least
 * {@link #MIN_SOLUTION_ACTIONS} actions long; shorter arrivals are dropped and the search goes
 * on. Because goal arrivals are checked when a state is generated, the first accepted path is
 * also a shortest one.
 *
 * <p>The solver keeps no state between calls and may be shared by concurrent callers.
 */
public final class BreadthFirstSolver implements Searcher {

    /**
     * Smallest number of actions a solution may use.
     */
    public static final int MIN_SOLUTION_ACTIONS = 2;

    private static final Logger LOGGER = Logger.getLogger(BreadthFirstSolver.class.getName());
    private static final Direction[] DIRECTIONS = MoveSimulator.SEARCH_ORDER.toArray(new Direction[0]);

    @Override
    public SearchResult findPath(Board board, TokenLayout layout, Color target, Position goal,
            SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(goal, "goal");
        Objects.requireNonNull(constraints, "constraints");

        long start = System.nanoTime();
        SearchResult result = search(board, layout, target, goal, constraints, start);
        LOGGER.info(() -> String.format("Search for %s to %s finished with %s: %d actions, %d states, %d ms",
                target.tag(), goal, result.status(), result.actionCount(), result.statesExplored(),
                result.elapsed().toMillis()));
        return result;
    }

    private SearchResult search(Board board, TokenLayout layout, Color target, Position goal,
            SearchConstraints constraints, long start) {
        Position targetStart = layout.positionOf(target).orElse(null);
        if (targetStart == null) {
            return SearchResult.failure(SearchStatus.TARGET_NOT_FOUND, 0L, elapsedSince(start), null);
        }
        if (!board.isValidPosition(goal)) {
            return SearchResult.failure(SearchStatus.INVALID_GOAL, 0L, elapsedSince(start), null);
        }
        if (!hasValidPlacement(board, layout)) {
            return SearchResult.failure(SearchStatus.INVALID_TOKEN_PLACEMENT, 0L, elapsedSince(start), null);
        }
        if (targetStart.equals(goal)) {
            return new SearchResult(SearchStatus.SOLVED, List.of(), 0L, elapsedSince(start), layout, null);
        }

        List<Color> colors = new ArrayList<>(layout.colors());
        int count = colors.size();
        int targetSlot = colors.indexOf(target);
        int goalCell = goal.index();
        int[] cells = new int[count];
        for (int slot = 0; slot < count; slot++) {
            cells[slot] = layout.positionOf(colors.get(slot)).orElseThrow().index();
        }

        MoveSimulator simulator = new MoveSimulator(board);
        VisitedStates visited = new VisitedStates();
        SearchFrontier frontier = new SearchFrontier();
        int rootKey = JointState.pack(cells, count);
        visited.add(rootKey);
        frontier.add(rootKey, SearchFrontier.NO_PARENT, SearchFrontier.NO_MOVE, 0);

        LayerCounter layer = new LayerCounter(0);
        List<SearchTelemetry.Layer> layers = new ArrayList<>();
        long explored = 0L;

        while (frontier.hasPending()) {
            if (explored >= constraints.stateLimit()) {
                layers.add(layer.close());
                LOGGER.log(Level.FINE, "State limit {0} reached", constraints.stateLimit());
                return SearchResult.failure(SearchStatus.SEARCH_SPACE_EXHAUSTED, explored, elapsedSince(start),
                        new SearchTelemetry(layers));
            }
            int node = frontier.poll();
            int depth = frontier.depth(node);
            if (depth != layer.depth) {
                layers.add(layer.close());
                layer = new LayerCounter(depth);
            }
            explored++;
            layer.dequeued++;

            int key = frontier.key(node);
            JointState.unpack(key, count, cells);
            int childDepth = depth + 1;

            for (int slot = 0; slot < count; slot++) {
                Color color = colors.get(slot);
                int origin = cells[slot];
                for (Direction direction : DIRECTIONS) {
                    int destination = simulator.slide(cells, count, slot, color, direction, null);
                    if (destination == origin) {
                        continue;
                    }
                    int childKey = JointState.withCell(key, slot, destination);
                    int move = SearchFrontier.encodeMove(slot, direction.ordinal());
                    if (slot == targetSlot && destination == goalCell) {
                        if (childDepth < MIN_SOLUTION_ACTIONS) {
                            layer.rejections++;
                            continue;
                        }
                        int solution = frontier.add(childKey, node, move, childDepth);
                        layers.add(layer.close());
                        return solved(simulator, layout, colors, frontier.pathTo(solution), explored, start,
                                new SearchTelemetry(layers));
                    }
                    if (!visited.add(childKey)) {
                        layer.duplicates++;
                        continue;
                    }
                    frontier.add(childKey, node, move, childDepth);
                    layer.enqueued++;
                }
            }
        }

        layers.add(layer.close());
        return SearchResult.failure(SearchStatus.NO_PATH, explored, elapsedSince(start), new SearchTelemetry(layers));
    }

    private static SearchResult solved(MoveSimulator simulator, TokenLayout layout, List<Color> colors, int[] path,
            long explored, long start, SearchTelemetry telemetry) {
        List<Action> actions = new ArrayList<>(path.length);
        TokenLayout current = layout;
        Direction[] byOrdinal = Direction.values();
        for (int move : path) {
            Color color = colors.get(SearchFrontier.moveSlot(move));
            Direction direction = byOrdinal[SearchFrontier.moveDirection(move)];
            Position from = current.positionOf(color).orElseThrow();
            MoveResult result = simulator.simulate(color, from, direction, current);
            actions.add(new Action(color, direction, from, result.finalPosition(), result.segments()));
            current = current.with(color, result.finalPosition());
        }
        return new SearchResult(SearchStatus.SOLVED, actions, explored, elapsedSince(start), current, telemetry);
    }

    private static boolean hasValidPlacement(Board board, TokenLayout layout) {
        Set<Position> occupied = new HashSet<>();
        for (Position position : layout.asMap().values()) {
            if (!board.isValidPosition(position) || !occupied.add(position)) {
                return false;
            }
        }
        return true;
    }

    private static Duration elapsedSince(long start) {
        return Duration.ofNanos(System.nanoTime() - start);
    }

    private static final class LayerCounter {

        private final int depth;
        private final long startNanos = System.nanoTime();
        private long dequeued;
        private long enqueued;
        private long duplicates;
        private long rejections;

        private LayerCounter(int depth) {
            this.depth = depth;
        }

        private SearchTelemetry.Layer close() {
            return new SearchTelemetry.Layer(depth, dequeued, enqueued, duplicates, rejections,
                    System.nanoTime() - startNanos);
        }
    }
}
