package com.refraction.core;

import java.util.List;
import java.util.Objects;

/**
 * Ordered assignment of a module face to each quadrant: top-left, top-right, bottom-left,
 * bottom-right.
 */
public record BoardConfiguration(List<QuadrantSelection> selections) {

    public BoardConfiguration {
        Objects.requireNonNull(selections, "selections");
        if (selections.size() != Quadrant.values().length) {
            throw new IllegalArgumentException("A board configuration needs exactly four quadrant selections");
        }
        selections = List.copyOf(selections);
    }

    public static BoardConfiguration of(QuadrantSelection topLeft, QuadrantSelection topRight,
            QuadrantSelection bottomLeft, QuadrantSelection bottomRight) {
        return new BoardConfiguration(List.of(topLeft, topRight, bottomLeft, bottomRight));
    }

    /**
     * Parses four comma separated {@code moduleId:faceIndex} pairs.
     */
    public static BoardConfiguration parse(String text) {
        String[] parts = text.split(",");
        if (parts.length != Quadrant.values().length) {
            throw new IllegalArgumentException("Expected four moduleId:faceIndex pairs but got: " + text);
        }
        return of(QuadrantSelection.parse(parts[0]), QuadrantSelection.parse(parts[1]),
                QuadrantSelection.parse(parts[2]), QuadrantSelection.parse(parts[3]));
    }

    public QuadrantSelection selection(Quadrant quadrant) {
        return selections.get(quadrant.ordinal());
    }

    @Override
    public String toString() {
        return selections.get(0) + "," + selections.get(1) + "," + selections.get(2) + "," + selections.get(3);
    }
}
