package com.refraction.core.module;

import com.refraction.core.CellGrid;
import com.refraction.core.Color;
import com.refraction.core.Corner;
import com.refraction.core.Orientation;
import com.refraction.core.Quadrant;
import java.util.List;
import java.util.Objects;

/**
 * Authored 8x8 tile with two selectable faces.
 *
 * @param id        catalogue identity
 * @param color     the module's color tag, distinct per quadrant on a board
 * @param gapCorner the corner that was next to the central gap when the tile was authored
 * @param faces     the two faces
 */
public record BoardModule(int id, Color color, Corner gapCorner, List<ModuleFace> faces) {

    public static final int FACE_COUNT = 2;

    public BoardModule {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(gapCorner, "gapCorner");
        Objects.requireNonNull(faces, "faces");
        if (!color.isConcrete()) {
            throw new IllegalArgumentException("Module color must be concrete: " + color);
        }
        if (faces.size() != FACE_COUNT) {
            throw new IllegalArgumentException("Module " + id + " must have exactly two faces, got " + faces.size());
        }
        faces = List.copyOf(faces);
    }

    public boolean hasFace(int faceIndex) {
        return faceIndex >= 0 && faceIndex < faces.size();
    }

    public ModuleFace face(int faceIndex) {
        if (!hasFace(faceIndex)) {
            throw new IllegalArgumentException("Face " + faceIndex + " not found in module " + id);
        }
        return faces.get(faceIndex);
    }

    public CellGrid materialize(int faceIndex) {
        return face(faceIndex).materialize();
    }

    /**
     * Materializes the face and rotates every wall, refractor and goal by {@code orientation}.
     */
    public CellGrid materialize(int faceIndex, Orientation orientation) {
        CellGrid grid = materialize(faceIndex);
        return orientation == Orientation.DEG_0 ? grid : grid.rotated(orientation);
    }

    /**
     * Returns the rotation that brings the authored gap corner onto the inner corner of
     * {@code quadrant}.
     */
    public Orientation rotationFor(Quadrant quadrant) {
        return gapCorner.rotationTo(quadrant.innerCorner());
    }
}
