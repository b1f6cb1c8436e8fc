package com.refraction.core;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Start-of-game checks for token layouts: every token must stand on a valid cell that is not
 * a refractor, and no two tokens may share a cell.
 */
public final class PlacementValidator {

    private PlacementValidator() {
    }

    public static List<PlacementProblem> validate(Board board, TokenLayout layout) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(layout, "layout");
        List<PlacementProblem> problems = new ArrayList<>();
        Map<Position, Color> occupied = new HashMap<>();
        for (Token token : layout.tokens()) {
            Position position = token.position();
            if (!Board.isInside(position.x(), position.y())) {
                problems.add(new PlacementProblem(PlacementProblem.Kind.OFF_BOARD, token.color(), position));
                continue;
            }
            if (Board.isInDeadZone(position)) {
                problems.add(new PlacementProblem(PlacementProblem.Kind.DEAD_ZONE, token.color(), position));
            } else if (board.refractorAt(position).isPresent()) {
                problems.add(new PlacementProblem(PlacementProblem.Kind.ON_REFRACTOR, token.color(), position));
            }
            if (occupied.putIfAbsent(position, token.color()) != null) {
                problems.add(new PlacementProblem(PlacementProblem.Kind.OVERLAP, token.color(), position));
            }
        }
        return problems;
    }

    public static void requireValid(Board board, TokenLayout layout) {
        List<PlacementProblem> problems = validate(board, layout);
        if (!problems.isEmpty()) {
            throw new InvalidPlacementException(problems);
        }
    }
}
