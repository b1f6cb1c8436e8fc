package com.refraction.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PlacementValidatorTest {

    private final Board board = Board.builder().refractor(3, 3, Diagonal.BACKSLASH, Color.YELLOW).build();

    @Test
    void acceptsSeparatedTokensOnPlainCells() {
        TokenLayout layout = TokenLayout.parse("red=0,0;yellow=15,0;blue=0,15;green=15,15");

        assertTrue(PlacementValidator.validate(board, layout).isEmpty());
    }

    @Test
    void reportsEveryProblem() {
        TokenLayout layout = TokenLayout.of(List.of(
                new Token(Color.RED, new Position(3, 3)),
                new Token(Color.YELLOW, new Position(7, 8)),
                new Token(Color.BLUE, new Position(16, 2)),
                new Token(Color.GREEN, new Position(3, 3))));

        List<PlacementProblem> problems = PlacementValidator.validate(board, layout);

        assertEquals(List.of(
                new PlacementProblem(PlacementProblem.Kind.ON_REFRACTOR, Color.RED, new Position(3, 3)),
                new PlacementProblem(PlacementProblem.Kind.DEAD_ZONE, Color.YELLOW, new Position(7, 8)),
                new PlacementProblem(PlacementProblem.Kind.OFF_BOARD, Color.BLUE, new Position(16, 2)),
                new PlacementProblem(PlacementProblem.Kind.ON_REFRACTOR, Color.GREEN, new Position(3, 3)),
                new PlacementProblem(PlacementProblem.Kind.OVERLAP, Color.GREEN, new Position(3, 3))),
                problems);
    }

    @Test
    void requireValidThrowsWithProblems() {
        TokenLayout layout = TokenLayout.parse("red=8,8");

        InvalidPlacementException ex = assertThrows(InvalidPlacementException.class,
                () -> PlacementValidator.requireValid(board, layout));
        assertEquals(1, ex.getProblems().size());
        assertEquals(PlacementProblem.Kind.DEAD_ZONE, ex.getProblems().get(0).kind());
    }
}
