package org.gridrealm.runtime.transition;

import org.gridrealm.runtime.api.DanglingTransitionException;
import org.gridrealm.runtime.api.OutOfBoundsException;
import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.Grid;
import org.gridrealm.runtime.model.Placement;

import java.util.Objects;

/**
 * A directed edge from a portal symbol to a spawn cell on a destination grid.
 * <p>
 * Links are immutable and stateless. A link may point back at the grid it is registered on;
 * whether entering the spawn cell triggers another transition is the caller's concern.
 */
public final class TransitionLink {

    private final char portalSymbol;
    private final Grid destination;
    private final Cell spawn;

    /**
     * Creates a new link.
     * @param portalSymbol The symbol that triggers this link.
     * @param destination The grid entities are moved to. Shared, not owned.
     * @param spawn The cell on the destination grid entities are moved to.
     * @throws OutOfBoundsException if the spawn cell lies outside the destination grid.
     */
    public TransitionLink(char portalSymbol, Grid destination, Cell spawn) {
        this.portalSymbol = portalSymbol;
        this.destination = Objects.requireNonNull(destination, "Destination grid cannot be null.");
        this.spawn = Objects.requireNonNull(spawn, "Spawn cell cannot be null.");
        if (!destination.isInBounds(spawn)) {
            throw new OutOfBoundsException(spawn.row(), spawn.col(), destination.getWidth(), destination.getHeight());
        }
    }

    /**
     * Moves the entity to the spawn cell of the destination grid in one placement swap.
     *
     * @param entity The entity to relocate.
     * @throws DanglingTransitionException if the destination grid has been retired; the entity is left untouched.
     */
    public void apply(Entity entity) throws DanglingTransitionException {
        if (destination.isRetired()) {
            throw new DanglingTransitionException(destination.getName());
        }
        entity.relocate(new Placement(destination, spawn));
    }

    public char getPortalSymbol() {
        return portalSymbol;
    }

    public Grid getDestination() {
        return destination;
    }

    public Cell getSpawn() {
        return spawn;
    }

    @Override
    public String toString() {
        return "TransitionLink{'" + portalSymbol + "' -> " + destination.getName() + "@" + spawn + "}";
    }
}
