package com.refraction.core;

/**
 * Grid coordinate. {@code x} grows to the right, {@code y} grows downwards.
 */
public record Position(int x, int y) {

    public Position step(Direction direction) {
        return new Position(x + direction.dx(), y + direction.dy());
    }

    public Position translate(int dx, int dy) {
        return new Position(x + dx, y + dy);
    }

    public boolean isInside(int size) {
        return x >= 0 && x < size && y >= 0 && y < size;
    }

    /**
     * Returns the row-major cell index of this position on the composite board.
     */
    public int index() {
        return y * Board.SIZE + x;
    }

    public static Position ofIndex(int index) {
        return new Position(index % Board.SIZE, index / Board.SIZE);
    }

    /**
     * Parses {@code "x,y"}.
     */
    public static Position parse(String text) {
        String[] parts = text.trim().split(",");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected x,y but got: " + text);
        }
        return new Position(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
