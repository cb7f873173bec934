package org.gridrealm.runtime.placement;

import org.gridrealm.runtime.collision.EntityRegistry;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.Grid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Erases and redraws the footprints on one grid in registration order.
 * <p>
 * A footprint records the symbols its art covered, which may include the glyphs of entities
 * drawn earlier. It can only be undone safely once every footprint drawn above it is undone.
 * Callers therefore lift the layers from an entity upwards, change the entity, and redraw the
 * lifted layers bottom-up:
 * <pre>
 * List&lt;Entity&gt; lifted = layers.liftFrom(grid, entity);
 * // move, transfer or unregister the entity
 * layers.redraw(grid, lifted);
 * </pre>
 */
public class FootprintLayers {

    private final EntityRegistry registry;
    private final ElementPlacer placer;

    public FootprintLayers(EntityRegistry registry, ElementPlacer placer) {
        this.registry = Objects.requireNonNull(registry, "Entity registry cannot be null.");
        this.placer = Objects.requireNonNull(placer, "Element placer cannot be null.");
    }

    /**
     * Erases, top-down, every footprint on the grid that belongs to the entity or to an entity
     * registered after it.
     *
     * @param grid The grid to erase on.
     * @param entity The lowest entity to lift. It need not be drawn on this grid.
     * @return The entity followed by the lifted entities above it, bottom-up.
     */
    public List<Entity> liftFrom(Grid grid, Entity entity) {
        List<Entity> layers = new ArrayList<>();
        layers.add(entity);
        List<Entity> candidates = registry.fromLayerOf(entity);
        for (int i = 1; i < candidates.size(); i++) {
            Footprint footprint = registry.footprintOf(candidates.get(i));
            if (footprint != null && footprint.grid() == grid) {
                layers.add(candidates.get(i));
            }
        }
        for (int i = layers.size() - 1; i >= 0; i--) {
            Entity layer = layers.get(i);
            Footprint footprint = registry.footprintOf(layer);
            if (footprint != null && footprint.grid() == grid) {
                placer.remove(grid, footprint);
                registry.setFootprint(layer, null);
            }
        }
        return layers;
    }

    /**
     * Draws the lifted entities back bottom-up. Entities that have left the grid or were
     * unregistered in the meantime are skipped.
     *
     * @param grid The grid to draw on.
     * @param lifted The list returned by {@link #liftFrom}.
     */
    public void redraw(Grid grid, List<Entity> lifted) {
        for (Entity entity : lifted) {
            if (registry.contains(entity.getId()) && entity.getGrid() == grid) {
                registry.setFootprint(entity, placer.place(grid, entity));
            }
        }
    }
}
