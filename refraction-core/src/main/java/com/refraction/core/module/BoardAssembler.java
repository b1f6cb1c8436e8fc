package com.refraction.core.module;

import com.refraction.core.Board;
import com.refraction.core.BoardConfiguration;
import com.refraction.core.BoardConstructionException;
import com.refraction.core.BoardConstructionException.Reason;
import com.refraction.core.CellGrid;
import com.refraction.core.Color;
import com.refraction.core.Goal;
import com.refraction.core.Orientation;
import com.refraction.core.Position;
import com.refraction.core.Quadrant;
import com.refraction.core.QuadrantSelection;
import com.refraction.core.Refractor;
import com.refraction.core.Side;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assembles four rotated modules into a composite {@link Board}.
 */
public final class BoardAssembler {

    private static final Logger LOGGER = Logger.getLogger(BoardAssembler.class.getName());

    private BoardAssembler() {
    }

    /**
     * Builds the board described by {@code configuration} from modules of {@code catalogue}.
     *
     * @throws BoardConstructionException if a module or face cannot be resolved or the quadrant
     *         colors are not four distinct colors
     */
    public static Board buildBoard(BoardConfiguration configuration, ModuleCatalogue catalogue) {
        Objects.requireNonNull(configuration, "configuration");
        Objects.requireNonNull(catalogue, "catalogue");

        Map<Quadrant, BoardModule> resolved = resolve(configuration, catalogue);

        Board.Builder builder = Board.builder().configuration(configuration);
        for (Quadrant quadrant : Quadrant.values()) {
            BoardModule module = resolved.get(quadrant);
            int faceIndex = configuration.selection(quadrant).faceIndex();
            Orientation rotation = module.rotationFor(quadrant);
            CellGrid grid = module.materialize(faceIndex, rotation);
            copyInto(builder, grid, quadrant);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(String.format("Placed module %d face %d in %s rotated %d degrees (%d refractors, %d goals)",
                        module.id(), faceIndex, quadrant, rotation.degrees(), grid.refractors().size(),
                        grid.goals().size()));
            }
        }
        Board board = builder.build();
        LOGGER.info(() -> String.format("Assembled board %s: %d walls, %d refractors, %d goals", configuration,
                board.wallCount(), board.refractorCount(), board.goals().size()));
        return board;
    }

    private static Map<Quadrant, BoardModule> resolve(BoardConfiguration configuration, ModuleCatalogue catalogue) {
        Map<Quadrant, BoardModule> resolved = new EnumMap<>(Quadrant.class);
        Set<Color> colors = EnumSet.noneOf(Color.class);
        for (Quadrant quadrant : Quadrant.values()) {
            QuadrantSelection selection = configuration.selection(quadrant);
            BoardModule module = catalogue.module(selection.moduleId())
                    .orElseThrow(() -> new BoardConstructionException(Reason.UNKNOWN_MODULE,
                            "Module " + selection.moduleId() + " not found"));
            if (!module.hasFace(selection.faceIndex())) {
                throw new BoardConstructionException(Reason.UNKNOWN_FACE,
                        "Face " + selection.faceIndex() + " not found in module " + module.id());
            }
            if (!colors.add(module.color())) {
                throw new BoardConstructionException(Reason.DUPLICATE_COLOR,
                        "Duplicate color: " + module.color().tag());
            }
            resolved.put(quadrant, module);
        }
        if (colors.size() != Quadrant.values().length) {
            throw new BoardConstructionException(Reason.COLOR_COUNT, "Board must have 4 different colors");
        }
        return resolved;
    }

    private static void copyInto(Board.Builder builder, CellGrid grid, Quadrant quadrant) {
        int ox = quadrant.offsetX();
        int oy = quadrant.offsetY();
        for (int y = 0; y < grid.size(); y++) {
            for (int x = 0; x < grid.size(); x++) {
                for (Side side : Side.values()) {
                    if (grid.hasWall(x, y, side)) {
                        builder.wall(ox + x, oy + y, side);
                    }
                }
                Refractor refractor = grid.refractorAt(x, y);
                if (refractor != null) {
                    builder.refractor(refractor.movedTo(new Position(ox + x, oy + y)));
                }
                Goal goal = grid.goalAt(x, y);
                if (goal != null) {
                    builder.goal(goal.movedTo(new Position(ox + x, oy + y)));
                }
            }
        }
    }
}
