package com.refraction.core;

/**
 * One 8x8 region of the composite board, in configuration order.
 */
public enum Quadrant {
    TOP_LEFT(0, 0, Corner.BOTTOM_RIGHT),
    TOP_RIGHT(CellGrid.MODULE_SIZE, 0, Corner.BOTTOM_LEFT),
    BOTTOM_LEFT(0, CellGrid.MODULE_SIZE, Corner.TOP_RIGHT),
    BOTTOM_RIGHT(CellGrid.MODULE_SIZE, CellGrid.MODULE_SIZE, Corner.TOP_LEFT);

    private final int offsetX;
    private final int offsetY;
    private final Corner innerCorner;

    Quadrant(int offsetX, int offsetY, Corner innerCorner) {
        this.offsetX = offsetX;
        this.offsetY = offsetY;
        this.innerCorner = innerCorner;
    }

    public int offsetX() {
        return offsetX;
    }

    public int offsetY() {
        return offsetY;
    }

    /**
     * Returns the tile corner that touches the central dead zone once the module is placed in
     * this quadrant.
     */
    public Corner innerCorner() {
        return innerCorner;
    }

    public static Quadrant of(Position position) {
        boolean right = position.x() >= CellGrid.MODULE_SIZE;
        boolean bottom = position.y() >= CellGrid.MODULE_SIZE;
        if (bottom) {
            return right ? BOTTOM_RIGHT : BOTTOM_LEFT;
        }
        return right ? TOP_RIGHT : TOP_LEFT;
    }
}
