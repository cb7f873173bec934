package org.gridrealm.app;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.gridrealm.runtime.World;
import org.gridrealm.runtime.collision.BlockerSet;
import org.gridrealm.runtime.internal.services.SeededRandomProvider;
import org.gridrealm.runtime.model.Art;
import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.EntityKind;
import org.gridrealm.runtime.model.Grid;
import org.gridrealm.runtime.model.Placement;
import org.gridrealm.runtime.spi.IRandomProvider;
import org.gridrealm.runtime.systems.SystemRegistry;
import org.gridrealm.runtime.transition.TransitionLink;
import org.gridrealm.runtime.worldgen.GridGeneratorFactory;
import org.gridrealm.runtime.worldgen.IGridGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link World} from the {@code gridrealm.world} section of the configuration.
 *
 * <pre>
 * gridrealm.world {
 *   seed = 42
 *   player { level = "dungeon", row = 1, col = 1, symbol = "@" }
 *   levels = [
 *     {
 *       name = "dungeon", width = 21, height = 11
 *       generator { type = "maze" }
 *       blockers = "#"
 *       portals = [ { symbol = "D", row = 9, col = 19, destination = "town", spawn-row = 1, spawn-col = 1 } ]
 *     }
 *   ]
 * }
 * </pre>
 * Each level draws from its own random sub-stream, derived from the world seed and the level's
 * index, so adding a level at the end does not change the ones before it.
 */
public final class WorldLoader {

    private static final Logger LOG = LoggerFactory.getLogger(WorldLoader.class);
    static final String WORLD_PATH = "gridrealm.world";

    private WorldLoader() {
    }

    /**
     * Assembles a world with a fresh system registry.
     * @param config The application configuration.
     * @return The world and its player.
     * @throws IllegalArgumentException if the world section is inconsistent.
     */
    public static LoadedWorld load(Config config) {
        return load(config, new SystemRegistry());
    }

    /**
     * Assembles a world.
     * @param config The application configuration.
     * @param systems The system registry the world updates every turn.
     * @return The world and its player.
     * @throws IllegalArgumentException if the world section is missing or inconsistent.
     */
    public static LoadedWorld load(Config config, SystemRegistry systems) {
        final Config worldConfig;
        try {
            worldConfig = config.getConfig(WORLD_PATH);
        } catch (ConfigException.Missing e) {
            throw new IllegalArgumentException("Configuration has no '" + WORLD_PATH + "' section", e);
        }

        long seed = worldConfig.hasPath("seed") ? worldConfig.getLong("seed") : 0L;
        IRandomProvider random = new SeededRandomProvider(seed);
        World world = new World(systems);

        List<? extends Config> levels = worldConfig.getConfigList("levels");
        for (int i = 0; i < levels.size(); i++) {
            Config level = levels.get(i);
            Grid grid = buildLevel(level, random.deriveFor("level", i));
            String blockers = level.hasPath("blockers") ? level.getString("blockers") : String.valueOf(org.gridrealm.runtime.Config.WALL);
            world.registerGrid(grid, BlockerSet.of(blockers));
        }

        for (Config level : levels) {
            if (level.hasPath("portals")) {
                linkPortals(world, world.getGrid(level.getString("name")), level.getConfigList("portals"));
            }
        }

        Entity player = null;
        if (worldConfig.hasPath("player")) {
            player = spawnPlayer(world, worldConfig.getConfig("player"));
        }

        LOG.info("Loaded world with {} levels (seed {})", levels.size(), seed);
        return new LoadedWorld(world, player);
    }

    private static Entity spawnPlayer(World world, Config player) {
        Grid grid = world.getGrid(player.getString("level"));
        Cell cell = new Cell(player.getInt("row"), player.getInt("col"));
        if (!player.hasPath("symbol")) {
            return world.spawnPlayer(grid.getName(), cell);
        }
        String symbol = player.getString("symbol");
        if (symbol.length() != 1) {
            throw new IllegalArgumentException("Player symbol must be a single character, got '" + symbol + "'");
        }
        Entity entity = new Entity(world.getEntities().nextId(), EntityKind.PLAYER, Art.of(symbol.charAt(0)),
                new Placement(grid, cell));
        return world.spawn(entity);
    }

    private static Grid buildLevel(Config level, IRandomProvider random) {
        String name = level.getString("name");
        int width = level.getInt("width");
        int height = level.getInt("height");

        Map<String, Object> params = new HashMap<>();
        String type = "room";
        if (level.hasPath("generator")) {
            params.putAll(level.getConfig("generator").root().unwrapped());
            Object configuredType = params.remove("type");
            if (configuredType != null) {
                type = configuredType.toString();
            }
        }

        Grid grid = Grid.filled(name, width, height, GridGeneratorFactory.initialFill(type, params));
        IGridGenerator generator = GridGeneratorFactory.create(type, params, random);
        generator.generate(grid);
        LOG.debug("Generated level '{}' ({}x{}) with '{}' generator", name, width, height, type);
        return grid;
    }

    private static void linkPortals(World world, Grid source, List<? extends Config> portals) {
        for (Config portal : portals) {
            String symbol = portal.getString("symbol");
            if (symbol.length() != 1) {
                throw new IllegalArgumentException("Portal symbol on grid '" + source.getName()
                        + "' must be a single character, got '" + symbol + "'");
            }
            Grid destination = world.getGrid(portal.getString("destination"));
            Cell spawn = new Cell(portal.getInt("spawn-row"), portal.getInt("spawn-col"));
            TransitionLink link = new TransitionLink(symbol.charAt(0), destination, spawn);
            world.link(source, link);
            if (portal.hasPath("row") && portal.hasPath("col")) {
                source.set(portal.getInt("row"), portal.getInt("col"), symbol.charAt(0));
            }
        }
    }
}
