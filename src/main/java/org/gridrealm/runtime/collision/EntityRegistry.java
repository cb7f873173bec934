package org.gridrealm.runtime.collision;

import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.Grid;
import org.gridrealm.runtime.placement.Footprint;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Owns the live entities of a world and the footprint each one currently has drawn.
 * An entity ceases to exist for the engine once it is removed from here.
 */
public class EntityRegistry implements IOccupancyView {

    private final Map<Integer, Entity> entities = new LinkedHashMap<>();
    private final Map<Integer, Footprint> footprints = new HashMap<>();
    private int nextId = 1;

    /**
     * Returns the next unused entity id.
     * @return A unique id.
     */
    public int nextId() {
        while (entities.containsKey(nextId)) {
            nextId++;
        }
        return nextId++;
    }

    /**
     * Adds an entity.
     * @param entity The entity to add.
     * @throws IllegalArgumentException if an entity with the same id is already registered.
     */
    public void add(Entity entity) {
        if (entities.containsKey(entity.getId())) {
            throw new IllegalArgumentException("Entity with id " + entity.getId() + " is already registered.");
        }
        entities.put(entity.getId(), entity);
    }

    /**
     * Removes an entity and forgets its footprint.
     * @param id The entity id.
     * @return The removed entity, or null if there was none.
     */
    public Entity remove(int id) {
        footprints.remove(id);
        return entities.remove(id);
    }

    /**
     * Gets an entity by id.
     * @param id The entity id.
     * @return The entity.
     * @throws IllegalArgumentException if no entity has this id.
     */
    public Entity get(int id) {
        Entity entity = entities.get(id);
        if (entity == null) {
            throw new IllegalArgumentException("No entity registered with id " + id);
        }
        return entity;
    }

    public boolean contains(int id) {
        return entities.containsKey(id);
    }

    /**
     * Lists an entity and every entity registered after it, in registration order. Later
     * entities are drawn on top of earlier ones.
     * @param entity A registered entity.
     * @return The entity followed by the entities layered above it.
     */
    public List<Entity> fromLayerOf(Entity entity) {
        List<Entity> result = new ArrayList<>();
        boolean reached = false;
        for (Entity candidate : entities.values()) {
            reached |= candidate.getId() == entity.getId();
            if (reached) {
                result.add(candidate);
            }
        }
        return result;
    }

    public void setFootprint(Entity entity, Footprint footprint) {
        if (footprint == null) {
            footprints.remove(entity.getId());
        } else {
            footprints.put(entity.getId(), footprint);
        }
    }

    @Override
    public Footprint footprintOf(Entity entity) {
        return footprints.get(entity.getId());
    }

    @Override
    public boolean isOccupiedByOther(Grid grid, Cell cell, Entity mover) {
        for (Entity other : entities.values()) {
            if (other.getId() == mover.getId() || other.getGrid() != grid) {
                continue;
            }
            Footprint footprint = footprints.get(other.getId());
            if (footprint != null && footprint.grid() == grid) {
                if (footprint.covers(cell)) {
                    return true;
                }
            } else if (other.getPosition().equals(cell)) {
                return true;
            }
        }
        return false;
    }

    public int size() {
        return entities.size();
    }
}
