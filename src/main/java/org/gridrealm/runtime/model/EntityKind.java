package org.gridrealm.runtime.model;

/**
 * Tagged capability set of an entity. Movement and collision consult the kind instead of
 * relying on subclass behaviour.
 */
public enum EntityKind {
    /** The controlled character. Cannot share a cell with another entity. */
    PLAYER(false, 'X'),
    /** A draggable editor element. May overlap other entities. */
    ELEMENT(true, '?');

    private final boolean coOccupancyAllowed;
    private final char defaultSymbol;

    EntityKind(boolean coOccupancyAllowed, char defaultSymbol) {
        this.coOccupancyAllowed = coOccupancyAllowed;
        this.defaultSymbol = defaultSymbol;
    }

    public boolean isCoOccupancyAllowed() {
        return coOccupancyAllowed;
    }

    public char getDefaultSymbol() {
        return defaultSymbol;
    }
}
