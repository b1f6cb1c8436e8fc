package com.refraction.core.module;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.refraction.core.Board;
import com.refraction.core.BoardConfiguration;
import com.refraction.core.BoardConstructionException;
import com.refraction.core.Cell;
import com.refraction.core.Color;
import com.refraction.core.Corner;
import com.refraction.core.Diagonal;
import com.refraction.core.Goal;
import com.refraction.core.Orientation;
import com.refraction.core.Position;
import com.refraction.core.Quadrant;
import com.refraction.core.QuadrantSelection;
import com.refraction.core.Refractor;
import com.refraction.core.Side;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class BoardAssemblerTest {

    private static final ModuleCatalogue CATALOGUE = ModuleCatalogue.loadDefault();

    @Test
    void everyCatalogueBoardKeepsItsInvariants() {
        List<Color> order = new ArrayList<>(Color.CONCRETE);
        for (int shift = 0; shift < 4; shift++) {
            for (int modulePick = 0; modulePick < 16; modulePick++) {
                for (int facePick = 0; facePick < 16; facePick++) {
                    List<QuadrantSelection> selections = new ArrayList<>();
                    for (int q = 0; q < 4; q++) {
                        Color color = order.get((q + shift) % 4);
                        BoardModule module = CATALOGUE.modulesOfColor(color).get((modulePick >> q) & 1);
                        selections.add(new QuadrantSelection(module.id(), (facePick >> q) & 1));
                    }
                    BoardConfiguration configuration = new BoardConfiguration(selections);
                    assertInvariants(BoardAssembler.buildBoard(configuration, CATALOGUE), configuration);
                }
            }
        }
    }

    @Test
    void placesRotatedContentInEachQuadrant() {
        BoardConfiguration configuration = BoardConfiguration.parse("0:0,2:0,4:0,6:0");
        Board board = BoardAssembler.buildBoard(configuration, CATALOGUE);

        assertEquals(configuration, board.configuration().orElseThrow());
        // top-left keeps its authored orientation
        Refractor topLeft = board.refractorAt(new Position(4, 3)).orElseThrow();
        assertSame(Diagonal.BACKSLASH, topLeft.diagonal());
        assertSame(Color.BLUE, topLeft.color());
        assertEquals(new Position(1, 2), board.goalById("0A-red-circle").orElseThrow().position());
        // top-right is turned half way round
        assertEquals(new Position(13, 3), board.goalById("2A-red-square").orElseThrow().position());
        assertSame(Diagonal.SLASH, board.refractorAt(new Position(11, 4)).orElseThrow().diagonal());
        // bottom-left is turned three quarters, which flips diagonals
        Refractor bottomLeft = board.refractorAt(new Position(1, 10)).orElseThrow();
        assertSame(Diagonal.BACKSLASH, bottomLeft.diagonal());
        assertSame(Color.YELLOW, bottomLeft.color());
        assertEquals(new Position(3, 10), board.goalById("4A-blue-triangle").orElseThrow().position());
        // bottom-right needs no rotation
        assertEquals(new Position(14, 13), board.goalById("6A-green-square").orElseThrow().position());
        assertEquals(16, board.goals().size());
        assertEquals(8, board.refractorCount());
    }

    @Test
    void keepsSeamWallsAndMirrorsThemAcrossQuadrants() {
        ModuleFace walled = new ModuleFace(List.of(
                WallSpec.of(7, 2, Side.RIGHT),
                WallSpec.of(0, 3, Side.LEFT),
                WallSpec.of(3, 7, Side.BOTTOM)), List.of(), List.of());
        ModuleFace empty = new ModuleFace(List.of(), List.of(), List.of());
        ModuleCatalogue catalogue = new ModuleCatalogue(List.of(
                new BoardModule(1, Color.RED, Corner.BOTTOM_RIGHT, List.of(walled, empty)),
                new BoardModule(2, Color.YELLOW, Corner.BOTTOM_RIGHT, List.of(walled, empty)),
                new BoardModule(3, Color.BLUE, Corner.BOTTOM_RIGHT, List.of(empty, empty)),
                new BoardModule(4, Color.GREEN, Corner.BOTTOM_RIGHT, List.of(empty, empty))));

        Board board = BoardAssembler.buildBoard(BoardConfiguration.parse("1:0,2:0,3:0,4:0"), catalogue);

        assertTrue(board.hasWall(7, 2, Side.RIGHT));
        assertTrue(board.hasWall(8, 2, Side.LEFT));
        assertTrue(board.hasWall(3, 7, Side.BOTTOM));
        assertTrue(board.hasWall(3, 8, Side.TOP));
        // the top-right copy is turned a quarter, its right wall becomes a bottom wall
        assertTrue(board.hasWall(13, 7, Side.BOTTOM));
        assertTrue(board.hasWall(13, 8, Side.TOP));
        assertTrue(board.hasWall(7, 3, Side.RIGHT));
        assertEquals(76 + 4, board.wallCount());
    }

    @Test
    void computesRotationFromGapCorner() {
        assertSame(Orientation.DEG_0, CATALOGUE.module(0).orElseThrow().rotationFor(Quadrant.TOP_LEFT));
        assertSame(Orientation.DEG_180, CATALOGUE.module(1).orElseThrow().rotationFor(Quadrant.TOP_LEFT));
        assertSame(Orientation.DEG_180, CATALOGUE.module(2).orElseThrow().rotationFor(Quadrant.TOP_RIGHT));
        assertSame(Orientation.DEG_270, CATALOGUE.module(4).orElseThrow().rotationFor(Quadrant.BOTTOM_LEFT));
        assertSame(Orientation.DEG_270, CATALOGUE.module(6).orElseThrow().rotationFor(Quadrant.TOP_RIGHT));
    }

    @Test
    void rejectsDuplicateColors() {
        BoardConstructionException ex = assertThrows(BoardConstructionException.class,
                () -> BoardAssembler.buildBoard(BoardConfiguration.parse("0:0,1:0,2:0,4:0"), CATALOGUE));
        assertSame(BoardConstructionException.Reason.DUPLICATE_COLOR, ex.getReason());
    }

    @Test
    void rejectsUnknownModulesAndFaces() {
        BoardConstructionException module = assertThrows(BoardConstructionException.class,
                () -> BoardAssembler.buildBoard(BoardConfiguration.parse("0:0,2:0,4:0,99:0"), CATALOGUE));
        assertSame(BoardConstructionException.Reason.UNKNOWN_MODULE, module.getReason());

        BoardConstructionException face = assertThrows(BoardConstructionException.class,
                () -> BoardAssembler.buildBoard(BoardConfiguration.parse("0:2,2:0,4:0,6:0"), CATALOGUE));
        assertSame(BoardConstructionException.Reason.UNKNOWN_FACE, face.getReason());
    }

    private static void assertInvariants(Board board, BoardConfiguration configuration) {
        for (int y = 0; y < Board.SIZE; y++) {
            for (int x = 0; x < Board.SIZE; x++) {
                for (Side side : Side.values()) {
                    int nx = x + side.dx();
                    int ny = y + side.dy();
                    if (!Board.isInside(nx, ny)) {
                        assertTrue(board.hasWall(x, y, side), "Open boundary at " + x + "," + y + " on " + configuration);
                    } else {
                        assertEquals(board.hasWall(x, y, side), board.hasWall(nx, ny, side.opposite()),
                                "Asymmetric wall at " + x + "," + y + " " + side + " on " + configuration);
                    }
                }
                Cell cell = board.cell(x, y);
                if (Board.isInDeadZone(x, y)) {
                    assertEquals(0xF, cell.walls());
                    assertTrue(cell.isEmpty());
                }
            }
        }
        Set<String> ids = new HashSet<>();
        for (Goal goal : board.goals()) {
            assertTrue(ids.add(goal.id()), "Duplicate goal " + goal.id());
            assertTrue(board.isValidPosition(goal.position()));
        }
        assertEquals(16, ids.size());
    }
}
