package com.refraction.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable assignment of positions to token colors. Iteration always follows the canonical
 * color order, so two layouts with the same tokens are indistinguishable regardless of how
 * they were built.
 */
public final class TokenLayout {

    private final EnumMap<Color, Position> positions;

    private TokenLayout(EnumMap<Color, Position> positions) {
        this.positions = positions;
    }

    public static TokenLayout of(Map<Color, Position> positions) {
        Objects.requireNonNull(positions, "positions");
        EnumMap<Color, Position> copy = new EnumMap<>(Color.class);
        for (Map.Entry<Color, Position> entry : positions.entrySet()) {
            Token token = new Token(entry.getKey(), entry.getValue());
            copy.put(token.color(), token.position());
        }
        return new TokenLayout(copy);
    }

    public static TokenLayout of(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens");
        EnumMap<Color, Position> copy = new EnumMap<>(Color.class);
        for (Token token : tokens) {
            if (copy.put(token.color(), token.position()) != null) {
                throw new IllegalArgumentException("Duplicate token color: " + token.color().tag());
            }
        }
        return new TokenLayout(copy);
    }

    public static TokenLayout empty() {
        return new TokenLayout(new EnumMap<>(Color.class));
    }

    /**
     * Parses a list such as {@code "red=0,0;blue=5,3"}.
     */
    public static TokenLayout parse(String text) {
        List<Token> tokens = new ArrayList<>();
        for (String entry : text.split(";")) {
            if (entry.isBlank()) {
                continue;
            }
            String[] parts = entry.split("=");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Expected color=x,y but got: " + entry);
            }
            tokens.add(new Token(Color.concreteFromTag(parts[0]), Position.parse(parts[1])));
        }
        return of(tokens);
    }

    /**
     * Returns a layout with the token of {@code color} placed at {@code position}.
     */
    public TokenLayout with(Color color, Position position) {
        Token token = new Token(color, position);
        EnumMap<Color, Position> copy = new EnumMap<>(positions);
        copy.put(token.color(), token.position());
        return new TokenLayout(copy);
    }

    public Optional<Position> positionOf(Color color) {
        return Optional.ofNullable(positions.get(color));
    }

    public boolean contains(Color color) {
        return positions.containsKey(color);
    }

    public int size() {
        return positions.size();
    }

    public Set<Color> colors() {
        return Collections.unmodifiableSet(positions.keySet());
    }

    /**
     * Returns the color of the token standing on {@code position}, if any.
     */
    public Optional<Color> colorAt(Position position) {
        for (Map.Entry<Color, Position> entry : positions.entrySet()) {
            if (entry.getValue().equals(position)) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public List<Token> tokens() {
        List<Token> tokens = new ArrayList<>(positions.size());
        for (Map.Entry<Color, Position> entry : positions.entrySet()) {
            tokens.add(new Token(entry.getKey(), entry.getValue()));
        }
        return tokens;
    }

    public Map<Color, Position> asMap() {
        return Collections.unmodifiableMap(positions);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TokenLayout)) {
            return false;
        }
        return positions.equals(((TokenLayout) o).positions);
    }

    @Override
    public int hashCode() {
        return positions.hashCode();
    }

    @Override
    public String toString() {
        return tokens().toString();
    }
}
