package com.refraction.core.module;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.refraction.core.BoardConfiguration;
import com.refraction.core.CellGrid;
import com.refraction.core.Color;
import com.refraction.core.Corner;
import com.refraction.core.Diagonal;
import com.refraction.core.Goal;
import com.refraction.core.Position;
import com.refraction.core.QuadrantSelection;
import com.refraction.core.Refractor;
import com.refraction.core.Shape;
import com.refraction.core.Side;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Read-only collection of authored modules, keyed by id.
 */
public final class ModuleCatalogue {

    private static final Logger LOGGER = Logger.getLogger(ModuleCatalogue.class.getName());
    private static final String DEFAULT_RESOURCE = "/modules.json";

    private final Map<Integer, BoardModule> modules;

    public ModuleCatalogue(Collection<BoardModule> modules) {
        Objects.requireNonNull(modules, "modules");
        Map<Integer, BoardModule> byId = new LinkedHashMap<>();
        for (BoardModule module : modules) {
            if (byId.put(module.id(), module) != null) {
                throw new IllegalArgumentException("Duplicate module id: " + module.id());
            }
        }
        this.modules = Collections.unmodifiableMap(byId);
    }

    /**
     * Loads the catalogue bundled with the library.
     */
    public static ModuleCatalogue loadDefault() {
        try (InputStream input = ModuleCatalogue.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new CatalogueLoadException("Missing catalogue resource " + DEFAULT_RESOURCE);
            }
            return load(input);
        } catch (IOException ex) {
            throw new CatalogueLoadException("Failed to read catalogue resource " + DEFAULT_RESOURCE, ex);
        }
    }

    /**
     * Parses a catalogue document of the form {@code {"modules": [ ... ]}}.
     */
    public static ModuleCatalogue load(InputStream input) {
        Objects.requireNonNull(input, "input");
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(input);
        } catch (IOException ex) {
            throw new CatalogueLoadException("Malformed catalogue JSON", ex);
        }
        JsonNode modulesNode = root == null ? null : root.path("modules");
        if (modulesNode == null || !modulesNode.isArray()) {
            throw new CatalogueLoadException("Catalogue must contain a \"modules\" array");
        }
        List<BoardModule> modules = new ArrayList<>();
        for (JsonNode moduleNode : modulesNode) {
            try {
                modules.add(parseModule(moduleNode));
            } catch (IllegalArgumentException ex) {
                throw new CatalogueLoadException("Invalid module " + moduleNode.path("id").asText("?")
                        + ": " + ex.getMessage(), ex);
            }
        }
        ModuleCatalogue catalogue = create(modules);
        LOGGER.info(() -> String.format("Loaded %d modules covering colors %s", catalogue.size(), catalogue.colors()));
        return catalogue;
    }

    public Optional<BoardModule> module(int id) {
        return Optional.ofNullable(modules.get(id));
    }

    public Collection<BoardModule> modules() {
        return modules.values();
    }

    public int size() {
        return modules.size();
    }

    public Set<Color> colors() {
        Set<Color> colors = EnumSet.noneOf(Color.class);
        for (BoardModule module : modules.values()) {
            colors.add(module.color());
        }
        return colors;
    }

    public List<BoardModule> modulesOfColor(Color color) {
        List<BoardModule> result = new ArrayList<>();
        for (BoardModule module : modules.values()) {
            if (module.color() == color) {
                result.add(module);
            }
        }
        return result;
    }

    /**
     * Draws one module of each of four distinct colors, a random face for each, and shuffles
     * them over the quadrants.
     */
    public BoardConfiguration randomConfiguration(Random random) {
        Objects.requireNonNull(random, "random");
        Map<Color, List<BoardModule>> byColor = new EnumMap<>(Color.class);
        for (BoardModule module : modules.values()) {
            byColor.computeIfAbsent(module.color(), ignored -> new ArrayList<>()).add(module);
        }
        if (byColor.size() < 4) {
            throw new IllegalStateException("Need at least four module colors, catalogue has " + byColor.size());
        }
        List<Color> colors = new ArrayList<>(byColor.keySet());
        Collections.shuffle(colors, random);
        List<QuadrantSelection> selections = new ArrayList<>();
        for (Color color : colors.subList(0, 4)) {
            List<BoardModule> candidates = byColor.get(color);
            BoardModule module = candidates.get(random.nextInt(candidates.size()));
            selections.add(new QuadrantSelection(module.id(), random.nextInt(BoardModule.FACE_COUNT)));
        }
        return new BoardConfiguration(selections);
    }

    private static ModuleCatalogue create(List<BoardModule> modules) {
        try {
            return new ModuleCatalogue(modules);
        } catch (IllegalArgumentException ex) {
            throw new CatalogueLoadException(ex.getMessage(), ex);
        }
    }

    private static BoardModule parseModule(JsonNode node) {
        int id = requiredInt(node, "id");
        Color color = Color.concreteFromTag(required(node, "color").asText());
        Corner gapCorner = Corner.of(parsePosition(required(node, "gapCorner")), CellGrid.MODULE_SIZE);
        List<ModuleFace> faces = new ArrayList<>();
        for (JsonNode faceNode : requiredArray(node, "faces")) {
            faces.add(parseFace(faceNode));
        }
        return new BoardModule(id, color, gapCorner, faces);
    }

    private static ModuleFace parseFace(JsonNode node) {
        List<WallSpec> walls = new ArrayList<>();
        for (JsonNode wallNode : optionalArray(node, "walls")) {
            Set<Side> sides = EnumSet.noneOf(Side.class);
            for (JsonNode sideNode : requiredArray(wallNode, "sides")) {
                sides.add(Side.fromTag(sideNode.asText()));
            }
            walls.add(new WallSpec(parsePosition(wallNode), sides));
        }
        List<Refractor> refractors = new ArrayList<>();
        for (JsonNode refractorNode : optionalArray(node, "refractors")) {
            refractors.add(new Refractor(parsePosition(refractorNode),
                    Diagonal.fromSymbol(required(refractorNode, "orientation").asText()),
                    Color.concreteFromTag(required(refractorNode, "color").asText())));
        }
        List<Goal> goals = new ArrayList<>();
        for (JsonNode goalNode : optionalArray(node, "goals")) {
            goals.add(new Goal(parsePosition(goalNode),
                    Shape.fromTag(required(goalNode, "shape").asText()),
                    Color.fromTag(required(goalNode, "color").asText()),
                    required(goalNode, "id").asText()));
        }
        return new ModuleFace(walls, refractors, goals);
    }

    private static Position parsePosition(JsonNode node) {
        return new Position(requiredInt(node, "x"), requiredInt(node, "y"));
    }

    private static int requiredInt(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new IllegalArgumentException("Field \"" + field + "\" must be an integer, got " + value);
        }
        return value.intValue();
    }

    private static JsonNode requiredArray(JsonNode node, String field) {
        JsonNode value = required(node, field);
        if (!value.isArray()) {
            throw new IllegalArgumentException("Field \"" + field + "\" must be an array, got " + value);
        }
        return value;
    }

    // Absent content lists mean an empty face.
    private static JsonNode optionalArray(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return MissingNode.getInstance();
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException("Field \"" + field + "\" must be an array, got " + value);
        }
        return value;
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field \"" + field + "\"");
        }
        return value;
    }
}
