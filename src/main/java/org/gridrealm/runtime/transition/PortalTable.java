package org.gridrealm.runtime.transition;

import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Grid;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-grid lookup from portal symbol to {@link TransitionLink}.
 */
public class PortalTable {

    private final Map<Grid, Map<Character, TransitionLink>> links = new IdentityHashMap<>();

    /**
     * Registers a link on a source grid.
     * @param source The grid the portal symbol appears on.
     * @param link The link to follow.
     * @throws IllegalArgumentException if the symbol is already linked on that grid.
     */
    public void register(Grid source, TransitionLink link) {
        Objects.requireNonNull(source, "Source grid cannot be null.");
        Objects.requireNonNull(link, "Link cannot be null.");
        Map<Character, TransitionLink> bySymbol = links.computeIfAbsent(source, g -> new HashMap<>());
        if (bySymbol.containsKey(link.getPortalSymbol())) {
            throw new IllegalArgumentException("Portal '" + link.getPortalSymbol() + "' is already linked on grid '"
                    + source.getName() + "'");
        }
        bySymbol.put(link.getPortalSymbol(), link);
    }

    /**
     * Removes every link registered on a grid.
     * @param source The source grid.
     */
    public void unregisterAll(Grid source) {
        links.remove(source);
    }

    /**
     * Looks up the transition triggered by the symbol at a cell.
     * @param grid The grid the cell belongs to.
     * @param cell The cell to inspect.
     * @return The link, or empty if the cell is out of bounds or not a portal.
     */
    public Optional<TransitionLink> checkTransition(Grid grid, Cell cell) {
        Map<Character, TransitionLink> bySymbol = links.get(grid);
        if (bySymbol == null || !grid.isInBounds(cell)) {
            return Optional.empty();
        }
        return Optional.ofNullable(bySymbol.get(grid.get(cell)));
    }
}
