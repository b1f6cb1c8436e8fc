package com.refraction.core;

import com.refraction.core.solver.Action;
import com.refraction.core.solver.SearchConstraints;
import com.refraction.core.solver.SearchResult;
import com.refraction.core.solver.Searcher;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Immutable multi-round game on one board. Each round picks an unused goal and a token that
 * may finish on it; a solved round moves every token to where the solution leaves it.
 */
public final class GameSession {

    private static final Logger LOGGER = Logger.getLogger(GameSession.class.getName());

    private static final Comparator<Goal> GOAL_ORDER = Comparator
            .comparingInt((Goal goal) -> colorRank(goal.color()))
            .thenComparing(Goal::shape);

    private final Board board;
    private final TokenLayout initialLayout;
    private final TokenLayout layout;
    private final List<Round> rounds;

    private GameSession(Board board, TokenLayout initialLayout, TokenLayout layout, List<Round> rounds) {
        this.board = board;
        this.initialLayout = initialLayout;
        this.layout = layout;
        this.rounds = rounds;
    }

    /**
     * Starts a session after checking the initial placement.
     *
     * @throws InvalidPlacementException if a token is off the board, in the dead zone, on a
     *         refractor or shares a cell with another token
     */
    public static GameSession start(Board board, TokenLayout layout) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(layout, "layout");
        if (layout.size() == 0) {
            throw new IllegalArgumentException("A game needs at least one token");
        }
        PlacementValidator.requireValid(board, layout);
        return new GameSession(board, layout, layout, List.of());
    }

    public Board board() {
        return board;
    }

    public TokenLayout layout() {
        return layout;
    }

    public TokenLayout initialLayout() {
        return initialLayout;
    }

    public List<Round> rounds() {
        return rounds;
    }

    /**
     * Returns the number the next round will carry, starting at 1.
     */
    public int nextRoundNumber() {
        return rounds.size() + 1;
    }

    /**
     * Returns the goals that are neither occupied by a token nor used by an earlier round,
     * wildcard goals first, then by color and shape.
     */
    public List<Goal> availableGoals() {
        Set<String> used = usedGoalIds();
        List<Goal> available = new ArrayList<>();
        for (Goal goal : board.goals()) {
            if (!used.contains(goal.id()) && layout.colorAt(goal.position()).isEmpty()) {
                available.add(goal);
            }
        }
        available.sort(GOAL_ORDER);
        return available;
    }

    /**
     * Returns the colors of the tokens in play that the goal accepts.
     */
    public List<Color> eligibleColors(String goalId) {
        Goal goal = requireGoal(goalId);
        List<Color> colors = new ArrayList<>();
        for (Color color : layout.colors()) {
            if (goal.accepts(color)) {
                colors.add(color);
            }
        }
        return colors;
    }

    /**
     * Searches for a solution bringing the {@code color} token onto the goal. A solved search
     * yields the successor session; any other status leaves this session as the outcome's
     * session.
     *
     * @throws IllegalArgumentException if the goal is unknown or does not accept the color
     * @throws IllegalStateException if the goal was already used or is occupied
     */
    public RoundOutcome playRound(String goalId, Color color, Searcher searcher, SearchConstraints constraints) {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(searcher, "searcher");
        Objects.requireNonNull(constraints, "constraints");
        Goal goal = requireGoal(goalId);
        if (usedGoalIds().contains(goalId)) {
            throw new IllegalStateException("Goal " + goalId + " was already used");
        }
        if (layout.colorAt(goal.position()).isPresent()) {
            throw new IllegalStateException("Goal " + goalId + " is occupied");
        }
        if (!layout.contains(color) || !goal.accepts(color)) {
            throw new IllegalArgumentException("Token " + color.tag() + " cannot finish on goal " + goalId);
        }

        SearchResult result = searcher.findPath(board, layout, color, goal.position(), constraints);
        if (!result.isSolved()) {
            LOGGER.info(() -> String.format("Round %d on %s with %s failed: %s", nextRoundNumber(), goalId,
                    color.tag(), result.status()));
            return new RoundOutcome(this, result, null);
        }

        Round round = new Round(nextRoundNumber(), goal, color, result.actions());
        List<Round> history = new ArrayList<>(rounds);
        history.add(round);
        GameSession next = new GameSession(board, initialLayout, result.finalLayout(),
                Collections.unmodifiableList(history));
        LOGGER.info(() -> String.format("Round %d: %s reached %s in %d actions", round.number(), color.tag(),
                goalId, round.actionCount()));
        return new RoundOutcome(next, result, round);
    }

    public RoundOutcome playRound(String goalId, Color color, Searcher searcher) {
        return playRound(goalId, color, searcher, SearchConstraints.defaults());
    }

    /**
     * Returns a session with the initial layout and no rounds played.
     */
    public GameSession reset() {
        return new GameSession(board, initialLayout, initialLayout, List.of());
    }

    public Statistics statistics() {
        int totalActions = 0;
        Map<Color, Integer> perColor = new EnumMap<>(Color.class);
        List<String> visited = new ArrayList<>();
        for (Round round : rounds) {
            totalActions += round.actionCount();
            perColor.merge(round.color(), 1, Integer::sum);
            visited.add(round.goal().id());
        }
        double average = rounds.isEmpty() ? 0.0 : (double) totalActions / rounds.size();
        return new Statistics(rounds.size(), totalActions, average, perColor, visited);
    }

    private Goal requireGoal(String goalId) {
        Objects.requireNonNull(goalId, "goalId");
        return board.goalById(goalId)
                .orElseThrow(() -> new IllegalArgumentException("Goal " + goalId + " not found"));
    }

    private Set<String> usedGoalIds() {
        Set<String> used = new HashSet<>();
        for (Round round : rounds) {
            used.add(round.goal().id());
        }
        return used;
    }

    private static int colorRank(Color color) {
        return color == Color.WILDCARD ? -1 : color.ordinal();
    }

    /**
     * A solved round.
     */
    public record Round(int number, Goal goal, Color color, List<Action> actions) {

        public Round {
            Objects.requireNonNull(goal, "goal");
            Objects.requireNonNull(color, "color");
            actions = List.copyOf(actions);
        }

        public int actionCount() {
            return actions.size();
        }
    }

    /**
     * Result of {@link #playRound}. {@code round} is {@code null} when the search failed.
     */
    public record RoundOutcome(GameSession session, SearchResult result, Round round) {

        public boolean isSolved() {
            return round != null;
        }
    }

    public record Statistics(int rounds, int totalActions, double averageActions, Map<Color, Integer> roundsPerColor,
            List<String> visitedGoalIds) {

        public Statistics {
            Map<Color, Integer> copy = new EnumMap<>(Color.class);
            copy.putAll(roundsPerColor);
            roundsPerColor = Collections.unmodifiableMap(copy);
            visitedGoalIds = List.copyOf(visitedGoalIds);
        }
    }
}
