package org.gridrealm.runtime.worldgen;

import org.gridrealm.runtime.model.Cell;

/**
 * Summary of one maze carve.
 *
 * @param start The cell carving started from, after clamping. Null if nothing was carved.
 * @param carvedCells The number of cells turned into floor.
 */
public record MazeResult(Cell start, int carvedCells) {

    static MazeResult empty() {
        return new MazeResult(null, 0);
    }

    public boolean isEmpty() {
        return carvedCells == 0;
    }
}
