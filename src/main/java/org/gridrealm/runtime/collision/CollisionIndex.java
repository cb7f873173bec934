package org.gridrealm.runtime.collision;

import org.gridrealm.runtime.api.Direction;
import org.gridrealm.runtime.api.MoveResult;
import org.gridrealm.runtime.model.Bounds;
import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.Grid;
import org.gridrealm.runtime.placement.Footprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decides whether cells are passable and applies single-step moves.
 * <p>
 * A move is a pure decision: when it is blocked, nothing about the entity changes.
 */
public class CollisionIndex {

    private static final Logger LOG = LoggerFactory.getLogger(CollisionIndex.class);

    private final IOccupancyView occupancy;

    public CollisionIndex(IOccupancyView occupancy) {
        this.occupancy = Objects.requireNonNull(occupancy, "Occupancy view cannot be null.");
    }

    /**
     * Checks whether the mover may enter a cell.
     * <p>
     * When the mover's own art covers the cell, the symbol underneath the art is tested against
     * the blockers, not the mover's glyph.
     *
     * @param grid The grid to test on.
     * @param cell The cell to enter.
     * @param blockers The impassable symbols of this grid.
     * @param mover The entity that wants to enter.
     * @return true if the cell is in bounds, not a blocker and not occupied by an exclusive neighbour.
     */
    public boolean canEnter(Grid grid, Cell cell, BlockerSet blockers, Entity mover) {
        if (!grid.isInBounds(cell)) {
            return false;
        }
        char symbol = grid.get(cell);
        Footprint own = occupancy.footprintOf(mover);
        if (own != null && own.grid() == grid) {
            symbol = own.symbolUnderneath(cell).orElse(symbol);
        }
        if (blockers.blocks(symbol)) {
            return false;
        }
        return mover.getKind().isCoOccupancyAllowed() || !occupancy.isOccupiedByOther(grid, cell, mover);
    }

    /**
     * Attempts to move an entity by a delta on its current grid.
     *
     * @param entity The entity to move.
     * @param rowDelta Rows to move.
     * @param colDelta Columns to move.
     * @param blockers The impassable symbols of the entity's grid.
     * @return {@link MoveResult#MOVED} if the placement was updated, else {@link MoveResult#BLOCKED}.
     */
    public MoveResult attemptMove(Entity entity, int rowDelta, int colDelta, BlockerSet blockers) {
        Cell target = entity.getPosition().offset(rowDelta, colDelta);
        Bounds bounds = entity.getBounds();
        if (bounds != null && !bounds.contains(target)) {
            LOG.debug("Entity {} blocked at {}: outside bounds {}", entity.getId(), target, bounds);
            return MoveResult.BLOCKED;
        }
        if (!canEnter(entity.getGrid(), target, blockers, entity)) {
            LOG.debug("Entity {} blocked at {} on grid '{}'", entity.getId(), target, entity.getGrid().getName());
            return MoveResult.BLOCKED;
        }
        entity.relocate(entity.getPlacement().at(target));
        return MoveResult.MOVED;
    }

    public MoveResult attemptMove(Entity entity, Direction direction, BlockerSet blockers) {
        return attemptMove(entity, direction.getRowDelta(), direction.getColDelta(), blockers);
    }
}
