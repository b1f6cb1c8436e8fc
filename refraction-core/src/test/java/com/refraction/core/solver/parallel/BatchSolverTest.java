package com.refraction.core.solver.parallel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.refraction.core.Board;
import com.refraction.core.Color;
import com.refraction.core.Diagonal;
import com.refraction.core.Position;
import com.refraction.core.TokenLayout;
import com.refraction.core.solver.BreadthFirstSolver;
import com.refraction.core.solver.SearchResult;
import com.refraction.core.solver.SearchStatus;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class BatchSolverTest {

    private static final Board BOARD = Board.builder()
            .refractor(3, 3, Diagonal.BACKSLASH, Color.YELLOW)
            .refractor(12, 4, Diagonal.SLASH, Color.RED)
            .build();

    @Test
    void matchesSequentialResultsInRequestOrder() {
        TokenLayout layout = TokenLayout.parse("red=0,3;blue=9,9");
        List<BatchSolver.SolveRequest> requests = new ArrayList<>();
        for (Color color : List.of(Color.RED, Color.BLUE, Color.YELLOW)) {
            requests.add(new BatchSolver.SolveRequest(layout, color, new Position(3, 15)));
            requests.add(new BatchSolver.SolveRequest(layout, color, new Position(14, 1)));
        }
        requests.add(new BatchSolver.SolveRequest(layout, Color.RED, new Position(8, 7)));

        List<SearchResult> results;
        try (BatchSolver batch = new BatchSolver(3)) {
            results = batch.solveAll(BOARD, requests);
        }

        assertEquals(requests.size(), results.size());
        BreadthFirstSolver sequential = new BreadthFirstSolver();
        for (int i = 0; i < requests.size(); i++) {
            BatchSolver.SolveRequest request = requests.get(i);
            SearchResult expected = sequential.findPath(BOARD, request.layout(), request.target(), request.goal());
            assertEquals(expected.status(), results.get(i).status(), "request " + i);
            assertEquals(expected.actions(), results.get(i).actions(), "request " + i);
        }
        assertEquals(SearchStatus.SOLVED, results.get(0).status());
        assertEquals(SearchStatus.TARGET_NOT_FOUND, results.get(4).status());
        assertEquals(SearchStatus.INVALID_GOAL, results.get(results.size() - 1).status());
    }

    @Test
    void refusesWorkAfterShutdown() {
        BatchSolver batch = new BatchSolver(1);
        batch.shutdown();

        assertThrows(IllegalStateException.class, () -> batch.solveAll(BOARD, List.of()));
    }

    @Test
    void requiresPositiveParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new BatchSolver(0));
    }
}
