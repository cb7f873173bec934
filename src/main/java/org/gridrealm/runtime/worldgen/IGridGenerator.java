package org.gridrealm.runtime.worldgen;

import org.gridrealm.runtime.model.Grid;

/**
 * Produces the initial contents of a grid. Called once, when a level is created.
 */
public interface IGridGenerator {

    /**
     * Writes the generated layout into the grid.
     *
     * @param grid The grid to be modified.
     */
    void generate(Grid grid);
}
