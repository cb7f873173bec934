package org.gridrealm.runtime;

import org.gridrealm.runtime.api.DanglingTransitionException;
import org.gridrealm.runtime.api.Direction;
import org.gridrealm.runtime.api.MoveResult;
import org.gridrealm.runtime.collision.BlockerSet;
import org.gridrealm.runtime.collision.CollisionIndex;
import org.gridrealm.runtime.collision.EntityRegistry;
import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.Grid;
import org.gridrealm.runtime.placement.ElementPlacer;
import org.gridrealm.runtime.placement.Footprint;
import org.gridrealm.runtime.placement.FootprintLayers;
import org.gridrealm.runtime.systems.SystemRegistry;
import org.gridrealm.runtime.systems.TurnContext;
import org.gridrealm.runtime.transition.PortalTable;
import org.gridrealm.runtime.transition.TransitionLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Holds the grids, entities, portals and auxiliary systems of a running game and applies moves.
 * <p>
 * Every move runs the same fixed sequence for one entity: collision check and position update,
 * erase of the entity's footprint and of every footprint drawn above it, transition check and
 * application, then redraw in registration order on the grids involved. Nothing else may mutate
 * the same grid or entity in between. The world is single-threaded and driven by the host's
 * input loop; it never schedules work on its own.
 */
public class World {

    private static final Logger LOG = LoggerFactory.getLogger(World.class);

    private final Map<String, Grid> grids = new LinkedHashMap<>();
    private final Map<Grid, BlockerSet> blockers = new IdentityHashMap<>();
    private final EntityRegistry entities = new EntityRegistry();
    private final PortalTable portals = new PortalTable();
    private final CollisionIndex collisions = new CollisionIndex(entities);
    private final FootprintLayers layers = new FootprintLayers(entities, new ElementPlacer());
    private final SystemRegistry systems;
    private long turn = 0L;

    public World() {
        this(new SystemRegistry());
    }

    /**
     * Constructs a new World.
     * @param systems The registry of auxiliary systems updated at the end of every turn.
     */
    public World(SystemRegistry systems) {
        this.systems = Objects.requireNonNull(systems, "System registry cannot be null.");
    }

    /**
     * Adds a grid to the world.
     * @param grid The grid.
     * @param gridBlockers The symbols that are impassable on it.
     * @throws IllegalArgumentException if a grid with the same name is already registered.
     */
    public void registerGrid(Grid grid, BlockerSet gridBlockers) {
        Objects.requireNonNull(grid, "Grid cannot be null.");
        Objects.requireNonNull(gridBlockers, "Blocker set cannot be null.");
        if (grids.containsKey(grid.getName())) {
            throw new IllegalArgumentException("Grid '" + grid.getName() + "' is already registered.");
        }
        grids.put(grid.getName(), grid);
        blockers.put(grid, gridBlockers);
        LOG.debug("Registered grid '{}' ({}x{}) with blockers {}", grid.getName(), grid.getWidth(), grid.getHeight(), gridBlockers.symbols());
    }

    /**
     * Takes a grid out of use. Links still pointing at it fail with {@link DanglingTransitionException}.
     * @param name The grid name.
     * @return The retired grid.
     */
    public Grid retireGrid(String name) {
        Grid grid = getGrid(name);
        grids.remove(name);
        portals.unregisterAll(grid);
        grid.retire();
        LOG.info("Retired grid '{}'", name);
        return grid;
    }

    /**
     * Gets a registered grid.
     * @param name The grid name.
     * @return The grid.
     * @throws IllegalArgumentException if no grid has this name.
     */
    public Grid getGrid(String name) {
        Grid grid = grids.get(name);
        if (grid == null) {
            throw new IllegalArgumentException("No grid registered under name '" + name + "'");
        }
        return grid;
    }

    public Collection<Grid> getGrids() {
        return Collections.unmodifiableCollection(grids.values());
    }

    /**
     * Gets the blockers of a grid.
     * @param grid The grid.
     * @return Its blocker set, or an empty set if the grid is unknown to this world.
     */
    public BlockerSet blockersFor(Grid grid) {
        return blockers.getOrDefault(grid, BlockerSet.none());
    }

    /**
     * Registers a portal link on a source grid.
     * @param source The grid the portal symbol appears on.
     * @param link The link.
     */
    public void link(Grid source, TransitionLink link) {
        requireRegistered(source);
        requireRegistered(link.getDestination());
        portals.register(source, link);
        LOG.debug("Linked '{}' on grid '{}' to '{}' at {}", link.getPortalSymbol(), source.getName(),
                link.getDestination().getName(), link.getSpawn());
    }

    /**
     * Adds an entity to the world and draws its art.
     * @param entity The entity, placed on a registered grid.
     * @return The entity.
     */
    public Entity spawn(Entity entity) {
        requireRegistered(entity.getGrid());
        entities.add(entity);
        layers.redraw(entity.getGrid(), layers.liftFrom(entity.getGrid(), entity));
        LOG.debug("Spawned {}", entity);
        return entity;
    }

    /**
     * Creates and spawns a player.
     * @param gridName The grid to spawn on.
     * @param cell The spawn cell.
     * @return The player entity.
     */
    public Entity spawnPlayer(String gridName, Cell cell) {
        return spawn(Entity.player(entities.nextId(), getGrid(gridName), cell));
    }

    /**
     * Removes an entity and erases its art.
     * @param id The entity id.
     * @return The removed entity.
     */
    public Entity despawn(int id) {
        Entity entity = entities.get(id);
        Footprint footprint = entities.footprintOf(entity);
        Grid grid = footprint != null ? footprint.grid() : entity.getGrid();
        List<Entity> lifted = layers.liftFrom(grid, entity);
        entities.remove(id);
        layers.redraw(grid, lifted);
        LOG.debug("Despawned {}", entity);
        return entity;
    }

    public TurnResult move(int entityId, Direction direction) throws DanglingTransitionException {
        return move(entityId, direction.getRowDelta(), direction.getColDelta());
    }

    /**
     * Moves an entity by a delta and follows a portal if it lands on one.
     *
     * @param entityId The entity to move.
     * @param rowDelta Rows to move.
     * @param colDelta Columns to move.
     * @return The outcome of the move.
     * @throws DanglingTransitionException if the entity landed on a portal into a retired grid.
     *         The entity then stays on the portal cell and is drawn there.
     */
    public TurnResult move(int entityId, int rowDelta, int colDelta) throws DanglingTransitionException {
        Entity entity = entities.get(entityId);
        Grid grid = entity.getGrid();
        MoveResult result = collisions.attemptMove(entity, rowDelta, colDelta, blockersFor(grid));
        if (result == MoveResult.BLOCKED) {
            return TurnResult.blocked();
        }

        // The entity and everything drawn above it are lifted, so the grid shows what lies underneath.
        List<Entity> lifted = layers.liftFrom(grid, entity);
        TransitionLink taken = null;
        try {
            taken = portals.checkTransition(grid, entity.getPosition()).orElse(null);
            if (taken != null) {
                taken.apply(entity);
                LOG.debug("Entity {} took {}", entityId, taken);
            }
        } catch (DanglingTransitionException e) {
            LOG.error("Entity {} stepped on portal into retired grid '{}'", entityId, e.getDestinationName());
            throw e;
        } finally {
            layers.redraw(grid, lifted);
            if (entity.getGrid() != grid) {
                layers.redraw(entity.getGrid(), layers.liftFrom(entity.getGrid(), entity));
            }
        }
        return new TurnResult(MoveResult.MOVED, taken);
    }

    /**
     * Completes the current turn by updating every registered turn system.
     * @return The number of the completed turn.
     */
    public long endTurn() {
        turn++;
        systems.updateAll(new TurnContext(turn, this, systems));
        return turn;
    }

    private void requireRegistered(Grid grid) {
        if (grids.get(grid.getName()) != grid) {
            throw new IllegalArgumentException("Grid '" + grid.getName() + "' is not registered in this world.");
        }
    }

    public EntityRegistry getEntities() {
        return entities;
    }

    public Entity getEntity(int id) {
        return entities.get(id);
    }

    public PortalTable getPortals() {
        return portals;
    }

    public CollisionIndex getCollisionIndex() {
        return collisions;
    }

    public SystemRegistry getSystems() {
        return systems;
    }

    public long getTurn() {
        return turn;
    }
}
