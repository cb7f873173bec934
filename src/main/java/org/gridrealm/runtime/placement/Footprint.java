package org.gridrealm.runtime.placement;

import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Grid;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Record of one {@link ElementPlacer#place} call: the grid written to and every write, in order,
 * with the symbol it replaced. Handing it back to {@link ElementPlacer#remove} restores the grid.
 *
 * @param grid The grid the art was written to.
 * @param writes The writes in the order they were applied.
 */
public record Footprint(Grid grid, List<CellWrite> writes) {

    /**
     * A single symbol written by a placement.
     *
     * @param cell The cell written.
     * @param previous The symbol the cell held before.
     * @param written The symbol written.
     */
    public record CellWrite(Cell cell, char previous, char written) {}

    public Footprint {
        Objects.requireNonNull(grid, "Footprint grid cannot be null.");
        writes = List.copyOf(writes);
    }

    /**
     * Checks whether the placement wrote to a cell.
     * @param cell The cell to check.
     * @return true if the cell is part of this footprint.
     */
    public boolean covers(Cell cell) {
        for (CellWrite write : writes) {
            if (write.cell().equals(cell)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the symbol the placement covered at a cell.
     * @param cell The cell to look up.
     * @return The symbol underneath the art, or empty if the cell is not part of this footprint.
     */
    public Optional<Character> symbolUnderneath(Cell cell) {
        for (CellWrite write : writes) {
            if (write.cell().equals(cell)) {
                return Optional.of(write.previous());
            }
        }
        return Optional.empty();
    }

    public boolean isEmpty() {
        return writes.isEmpty();
    }
}
