package com.refraction.core;

import java.util.List;
import java.util.Locale;

/**
 * Color tag shared by modules, refractors, goals and tokens. The declaration order of the
 * four concrete colors is the canonical token order used throughout the solver.
 */
public enum Color {
    RED,
    YELLOW,
    BLUE,
    GREEN,
    WILDCARD;

    /**
     * The four token colors in canonical order.
     */
    public static final List<Color> CONCRETE = List.of(RED, YELLOW, BLUE, GREEN);

    public boolean isConcrete() {
        return this != WILDCARD;
    }

    /**
     * Returns {@code true} if a goal tagged with this color accepts a token of {@code tokenColor}.
     */
    public boolean accepts(Color tokenColor) {
        return this == WILDCARD || this == tokenColor;
    }

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Color fromTag(String tag) {
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "red" -> RED;
            case "yellow" -> YELLOW;
            case "blue" -> BLUE;
            case "green" -> GREEN;
            case "wildcard", "rainbow" -> WILDCARD;
            default -> throw new IllegalArgumentException("Unknown color: " + tag);
        };
    }

    public static Color concreteFromTag(String tag) {
        Color color = fromTag(tag);
        if (!color.isConcrete()) {
            throw new IllegalArgumentException("A concrete color is required, got: " + tag);
        }
        return color;
    }
}
