package org.gridrealm.runtime.placement;

import org.gridrealm.runtime.model.Art;
import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.Grid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Composites an entity's art onto a grid and undoes it again.
 * <p>
 * {@link #place} and {@link #remove} must be strictly paired per move: placing twice without a
 * removal in between records the first placement's glyphs as the "previous" symbols and a later
 * removal would restore those instead of the original map.
 */
public class ElementPlacer {

    /**
     * Writes the entity's art onto the grid with its top-left corner at the entity's position.
     * Cells outside the grid are clipped; transparent cells are skipped.
     *
     * @param grid The grid to draw on.
     * @param entity The entity whose art is drawn.
     * @return The footprint needed to undo this placement.
     */
    public Footprint place(Grid grid, Entity entity) {
        Objects.requireNonNull(grid, "Grid cannot be null.");
        Objects.requireNonNull(entity, "Entity cannot be null.");
        Art art = entity.getArt();
        Cell origin = entity.getPosition();
        List<Footprint.CellWrite> writes = new ArrayList<>();
        for (int r = 0; r < art.getHeight(); r++) {
            int length = art.getLines().get(r).length();
            for (int c = 0; c < length; c++) {
                char symbol = art.symbolAt(r, c);
                if (symbol == Art.TRANSPARENT) {
                    continue;
                }
                Cell target = origin.offset(r, c);
                if (!grid.isInBounds(target)) {
                    continue;
                }
                writes.add(new Footprint.CellWrite(target, grid.get(target), symbol));
                grid.set(target, symbol);
            }
        }
        return new Footprint(grid, writes);
    }

    /**
     * Restores the symbols a placement replaced, in reverse write order.
     *
     * @param grid The grid the footprint was recorded on.
     * @param footprint The footprint returned by {@link #place}.
     * @throws IllegalArgumentException if the footprint belongs to another grid.
     */
    public void remove(Grid grid, Footprint footprint) {
        Objects.requireNonNull(grid, "Grid cannot be null.");
        Objects.requireNonNull(footprint, "Footprint cannot be null.");
        if (footprint.grid() != grid) {
            throw new IllegalArgumentException("Footprint was recorded on grid '" + footprint.grid().getName()
                    + "', not on '" + grid.getName() + "'");
        }
        List<Footprint.CellWrite> writes = footprint.writes();
        for (int i = writes.size() - 1; i >= 0; i--) {
            Footprint.CellWrite write = writes.get(i);
            grid.set(write.cell(), write.previous());
        }
    }
}
