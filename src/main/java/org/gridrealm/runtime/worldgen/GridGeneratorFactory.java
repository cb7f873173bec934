package org.gridrealm.runtime.worldgen;

import org.gridrealm.runtime.Config;
import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.spi.IRandomProvider;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A factory for creating grid generators.
 * It uses a registry to store the creator of each generator type.
 */
public class GridGeneratorFactory {

    private static final Map<String, IGridGeneratorCreator> registry = new HashMap<>();

    static {
        register("maze", (params, rngProvider) -> {
            char wall = symbol(params, "wall", Config.WALL);
            char floor = symbol(params, "floor", Config.FLOOR);
            Cell start = null;
            if (params.containsKey("start-row") && params.containsKey("start-col")) {
                start = new Cell(integer(params, "start-row"), integer(params, "start-col"));
            }
            return new MazeGenerator(rngProvider, wall, floor, start);
        });

        register("room", (params, rngProvider) -> new RoomGenerator(symbol(params, "floor", Config.FLOOR)));
    }

    private GridGeneratorFactory() {
    }

    /**
     * Registers a new generator creator.
     * @param type The type of the generator.
     * @param creator The creator for the generator.
     */
    public static void register(String type, IGridGeneratorCreator creator) {
        registry.put(type.toLowerCase(), creator);
    }

    /**
     * Creates a new grid generator.
     * @param type The type of the generator to create.
     * @param params The parameters for the generator.
     * @param rngProvider The random number provider.
     * @return The created generator.
     * @throws IllegalArgumentException if the generator type is unknown or a parameter is malformed.
     */
    public static IGridGenerator create(String type, Map<String, Object> params, IRandomProvider rngProvider) {
        Objects.requireNonNull(type, "Generator type cannot be null.");
        IGridGeneratorCreator creator = registry.get(type.toLowerCase());
        if (creator == null) {
            throw new IllegalArgumentException("Unknown grid generator type: " + type);
        }
        return creator.create(params != null ? params : Map.of(), rngProvider);
    }

    /**
     * Returns the fill symbol a generator of the given type expects the grid to start with.
     * @param type The generator type.
     * @param params The parameters for the generator.
     * @return The symbol to pre-fill the grid with.
     */
    public static char initialFill(String type, Map<String, Object> params) {
        Map<String, Object> p = params != null ? params : Map.of();
        return "maze".equalsIgnoreCase(type) ? symbol(p, "wall", Config.WALL) : symbol(p, "floor", Config.FLOOR);
    }

    private static int integer(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    private static char symbol(Map<String, Object> params, String key, char fallback) {
        Object value = params.get(key);
        if (value == null) {
            return fallback;
        }
        String text = value.toString();
        if (text.length() != 1) {
            throw new IllegalArgumentException("Parameter '" + key + "' must be a single character, got '" + text + "'");
        }
        return text.charAt(0);
    }
}
