package com.refraction.core;

/**
 * Module and face chosen for one quadrant.
 */
public record QuadrantSelection(int moduleId, int faceIndex) {

    public QuadrantSelection {
        if (faceIndex < 0) {
            throw new IllegalArgumentException("faceIndex must not be negative");
        }
    }

    /**
     * Parses {@code "moduleId:faceIndex"}.
     */
    public static QuadrantSelection parse(String text) {
        String[] parts = text.trim().split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected moduleId:faceIndex but got: " + text);
        }
        return new QuadrantSelection(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
    }

    @Override
    public String toString() {
        return moduleId + ":" + faceIndex;
    }
}
