package com.refraction.core;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when a starting token layout violates the placement rules. The caller may correct
 * the layout and retry.
 */
public final class InvalidPlacementException extends IllegalArgumentException {

    private final List<PlacementProblem> problems;

    public InvalidPlacementException(List<PlacementProblem> problems) {
        super(problems.stream().map(PlacementProblem::describe).collect(Collectors.joining("; ")));
        this.problems = List.copyOf(problems);
    }

    public List<PlacementProblem> getProblems() {
        return problems;
    }
}
