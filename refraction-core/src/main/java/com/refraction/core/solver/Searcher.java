package com.refraction.core.solver;

import com.refraction.core.Board;
import com.refraction.core.Color;
import com.refraction.core.Position;
import com.refraction.core.TokenLayout;

/**
 * Generic interface for puzzle solvers.
 */
public interface Searcher {

    /**
     * Searches for the shortest sequence of actions that brings the token of
     * {@code target} onto {@code goal}.
     *
     * @param board the board to search on, never modified
     * @param layout the starting token positions
     * @param target the color of the token that must reach the goal
     * @param goal the goal cell
     * @param constraints the limits guiding the search
     * @return the structured result; domain failures are reported through its status
     */
    SearchResult findPath(Board board, TokenLayout layout, Color target, Position goal,
            SearchConstraints constraints);

    default SearchResult findPath(Board board, TokenLayout layout, Color target, Position goal) {
        return findPath(board, layout, target, goal, SearchConstraints.defaults());
    }
}
