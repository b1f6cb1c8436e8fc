package com.refraction.core;

import java.util.Locale;

/**
 * Goal marker shape.
 */
public enum Shape {
    CIRCLE,
    TRIANGLE,
    SQUARE,
    HEXAGON;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Shape fromTag(String tag) {
        try {
            return valueOf(tag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown goal shape: " + tag, ex);
        }
    }
}
