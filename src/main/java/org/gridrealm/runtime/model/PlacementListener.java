package org.gridrealm.runtime.model;

/**
 * Observes placement changes of an entity.
 */
@FunctionalInterface
public interface PlacementListener {

    /**
     * Called after the entity's placement has been replaced.
     *
     * @param entity The entity that moved.
     * @param previous Its placement before the change.
     * @param current Its placement after the change.
     */
    void onPlacementChanged(Entity entity, Placement previous, Placement current);
}
