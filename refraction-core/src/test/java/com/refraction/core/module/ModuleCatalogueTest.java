package com.refraction.core.module;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.refraction.core.BoardConfiguration;
import com.refraction.core.Color;
import com.refraction.core.Corner;
import com.refraction.core.Diagonal;
import com.refraction.core.Position;
import com.refraction.core.QuadrantSelection;
import com.refraction.core.Side;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ModuleCatalogueTest {

    private static final String EMPTY_FACE = "{\"walls\":[],\"refractors\":[],\"goals\":[]}";

    @Test
    void loadsBundledCatalogue() {
        ModuleCatalogue catalogue = ModuleCatalogue.loadDefault();

        assertEquals(8, catalogue.size());
        assertEquals(EnumSet.of(Color.RED, Color.YELLOW, Color.BLUE, Color.GREEN), catalogue.colors());
        for (Color color : Color.CONCRETE) {
            assertEquals(2, catalogue.modulesOfColor(color).size());
        }

        BoardModule first = catalogue.module(0).orElseThrow();
        assertSame(Color.RED, first.color());
        assertSame(Corner.BOTTOM_RIGHT, first.gapCorner());
        ModuleFace face = first.face(0);
        assertEquals(2, face.refractors().size());
        assertEquals(4, face.goals().size());
        assertEquals(new Position(4, 3), face.refractors().get(0).position());
        assertSame(Diagonal.BACKSLASH, face.refractors().get(0).diagonal());
        assertTrue(catalogue.module(99).isEmpty());
    }

    @Test
    void parsesWallsRefractorsAndGoals() {
        String face = "{\"walls\":[{\"x\":3,\"y\":0,\"sides\":[\"right\",\"bottom\"]}],"
                + "\"refractors\":[{\"x\":4,\"y\":3,\"orientation\":\"/\",\"color\":\"green\"}],"
                + "\"goals\":[{\"x\":1,\"y\":2,\"shape\":\"circle\",\"color\":\"wildcard\",\"id\":\"w\"}]}";
        ModuleCatalogue catalogue = ModuleCatalogue.load(stream(document(module(5, "blue", 0, 7, face))));

        BoardModule module = catalogue.module(5).orElseThrow();
        assertSame(Corner.BOTTOM_LEFT, module.gapCorner());
        ModuleFace parsed = module.face(0);
        assertEquals(EnumSet.of(Side.RIGHT, Side.BOTTOM), parsed.walls().get(0).sides());
        assertSame(Diagonal.SLASH, parsed.refractors().get(0).diagonal());
        assertSame(Color.WILDCARD, parsed.goals().get(0).color());
        assertTrue(module.materialize(0).hasWall(4, 0, Side.LEFT));
    }

    @Test
    void rejectsMalformedDocuments() {
        assertThrows(CatalogueLoadException.class, () -> ModuleCatalogue.load(stream("{\"modules\": [")));
        assertThrows(CatalogueLoadException.class, () -> ModuleCatalogue.load(stream("{\"modules\": 5}")));
        assertThrows(CatalogueLoadException.class, () -> ModuleCatalogue.load(stream("[]")));
    }

    @Test
    void rejectsInvalidModules() {
        CatalogueLoadException missing = assertThrows(CatalogueLoadException.class,
                () -> ModuleCatalogue.load(stream("{\"modules\":[{\"id\":1,\"color\":\"red\"}]}")));
        assertTrue(missing.getMessage().contains("gapCorner"));

        assertThrows(CatalogueLoadException.class,
                () -> ModuleCatalogue.load(stream(document(module(1, "red", 3, 3, EMPTY_FACE)))));
        assertThrows(CatalogueLoadException.class,
                () -> ModuleCatalogue.load(stream(document(module(1, "wildcard", 0, 0, EMPTY_FACE)))));
        assertThrows(CatalogueLoadException.class, () -> ModuleCatalogue.load(stream(
                document(module(1, "red", 0, 0, EMPTY_FACE) + "," + module(1, "blue", 0, 0, EMPTY_FACE)))));
        String outside = "{\"walls\":[{\"x\":8,\"y\":0,\"sides\":[\"top\"]}],\"refractors\":[],\"goals\":[]}";
        assertThrows(CatalogueLoadException.class,
                () -> ModuleCatalogue.load(stream(document(module(1, "red", 0, 0, outside)))));
    }

    @Test
    void rejectsMistypedFields() {
        String textCoordinate = "{\"walls\":[{\"x\":\"seven\",\"y\":1,\"sides\":[\"top\"]}]}";
        CatalogueLoadException coordinate = assertThrows(CatalogueLoadException.class,
                () -> ModuleCatalogue.load(stream(document(module(1, "red", 0, 0, textCoordinate)))));
        assertTrue(coordinate.getMessage().contains("\"x\""));

        String fractionalCoordinate = "{\"goals\":[{\"x\":2.5,\"y\":1,\"shape\":\"circle\",\"color\":\"red\","
                + "\"id\":\"g\"}]}";
        assertThrows(CatalogueLoadException.class,
                () -> ModuleCatalogue.load(stream(document(module(1, "red", 0, 0, fractionalCoordinate)))));

        String textId = module(1, "red", 0, 0, EMPTY_FACE).replace("\"id\":1", "\"id\":\"abc\"");
        CatalogueLoadException id = assertThrows(CatalogueLoadException.class,
                () -> ModuleCatalogue.load(stream(document(textId))));
        assertTrue(id.getMessage().contains("\"id\""));

        String textSides = "{\"walls\":[{\"x\":3,\"y\":1,\"sides\":\"top\"}]}";
        CatalogueLoadException sides = assertThrows(CatalogueLoadException.class,
                () -> ModuleCatalogue.load(stream(document(module(1, "red", 0, 0, textSides)))));
        assertTrue(sides.getMessage().contains("\"sides\""));

        String objectWalls = "{\"walls\":{\"x\":3,\"y\":1,\"sides\":[\"top\"]}}";
        assertThrows(CatalogueLoadException.class,
                () -> ModuleCatalogue.load(stream(document(module(1, "red", 0, 0, objectWalls)))));

        String textFaces = "{\"id\":1,\"color\":\"red\",\"gapCorner\":{\"x\":0,\"y\":0},\"faces\":\"none\"}";
        assertThrows(CatalogueLoadException.class, () -> ModuleCatalogue.load(stream(document(textFaces))));
    }

    @Test
    void randomConfigurationUsesFourDistinctColors() {
        ModuleCatalogue catalogue = ModuleCatalogue.loadDefault();

        for (int seed = 0; seed < 20; seed++) {
            BoardConfiguration configuration = catalogue.randomConfiguration(new Random(seed));
            Set<Color> colors = new HashSet<>();
            for (QuadrantSelection selection : configuration.selections()) {
                BoardModule module = catalogue.module(selection.moduleId()).orElseThrow();
                colors.add(module.color());
                assertTrue(module.hasFace(selection.faceIndex()));
            }
            assertEquals(4, colors.size());
        }
        assertEquals(catalogue.randomConfiguration(new Random(7)), catalogue.randomConfiguration(new Random(7)));
    }

    @Test
    void randomConfigurationNeedsFourColors() {
        ModuleCatalogue catalogue = ModuleCatalogue.load(stream(document(
                module(1, "red", 0, 0, EMPTY_FACE) + "," + module(2, "blue", 0, 0, EMPTY_FACE))));

        assertThrows(IllegalStateException.class, () -> catalogue.randomConfiguration(new Random(1)));
    }

    private static String document(String modules) {
        return "{\"modules\":[" + modules + "]}";
    }

    private static String module(int id, String color, int gapX, int gapY, String face) {
        return "{\"id\":" + id + ",\"color\":\"" + color + "\",\"gapCorner\":{\"x\":" + gapX + ",\"y\":" + gapY
                + "},\"faces\":[" + face + "," + EMPTY_FACE + "]}";
    }

    private static InputStream stream(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
