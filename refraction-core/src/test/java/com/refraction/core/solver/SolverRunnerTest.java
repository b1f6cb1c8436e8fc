package com.refraction.core.solver;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.refraction.core.Board;
import com.refraction.core.Color;
import com.refraction.core.Goal;
import com.refraction.core.Position;
import com.refraction.core.Shape;
import org.junit.jupiter.api.Test;

class SolverRunnerTest {

    private final Board board = Board.builder()
            .goal(new Goal(new Position(4, 9), Shape.TRIANGLE, Color.GREEN, "green-triangle"))
            .build();

    @Test
    void resolvesGoalsByCoordinateOrId() {
        assertEquals(new Position(3, 12), SolverRunner.resolveGoal(board, "3,12"));
        assertEquals(new Position(4, 9), SolverRunner.resolveGoal(board, "green-triangle"));
    }

    @Test
    void rejectsUnknownGoalIds() {
        assertThrows(IllegalArgumentException.class, () -> SolverRunner.resolveGoal(board, "missing"));
    }
}
