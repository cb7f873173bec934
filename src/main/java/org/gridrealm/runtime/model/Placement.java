package org.gridrealm.runtime.model;

import java.util.Objects;

/**
 * Where an entity currently is: the grid it references and its anchor cell on that grid.
 * Grid and cell always change together by replacing the whole record.
 *
 * @param grid The active grid (referenced, not owned).
 * @param cell The anchor cell.
 */
public record Placement(Grid grid, Cell cell) {

    public Placement {
        Objects.requireNonNull(grid, "Placement grid cannot be null.");
        Objects.requireNonNull(cell, "Placement cell cannot be null.");
    }

    /**
     * Returns a placement on the same grid at another cell.
     * @param next The new cell.
     * @return The new placement.
     */
    public Placement at(Cell next) {
        return new Placement(grid, next);
    }

    @Override
    public String toString() {
        return grid.getName() + "@" + cell;
    }
}
