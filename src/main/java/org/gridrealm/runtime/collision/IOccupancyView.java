package org.gridrealm.runtime.collision;

import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.Grid;
import org.gridrealm.runtime.placement.Footprint;

/**
 * Read-only view of which entities currently occupy which cells.
 */
public interface IOccupancyView {

    /**
     * Checks whether any entity other than the mover occupies a cell.
     *
     * @param grid The grid the cell belongs to.
     * @param cell The cell to check.
     * @param mover The entity asking, excluded from the check.
     * @return true if another entity occupies the cell.
     */
    boolean isOccupiedByOther(Grid grid, Cell cell, Entity mover);

    /**
     * Gets the footprint currently drawn for an entity.
     *
     * @param entity The entity.
     * @return Its footprint, or null if it is not drawn.
     */
    Footprint footprintOf(Entity entity);
}
