package org.gridrealm.runtime.model;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A movable occupant of a grid.
 * <p>
 * An entity is a fixed core record (id, kind, art, optional bounds) plus a {@link Placement}.
 * The placement is replaced as a whole, so an observer never sees the grid of one placement
 * combined with the cell of another.
 */
public class Entity {

    private final int id;
    private final EntityKind kind;
    private final Art art;
    private Bounds bounds;
    private Placement placement;
    private final List<PlacementListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Constructs a new Entity.
     * @param id A unique id.
     * @param kind The kind of entity.
     * @param art The glyph drawn for this entity.
     * @param placement The initial placement.
     */
    public Entity(int id, EntityKind kind, Art art, Placement placement) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "Entity kind cannot be null.");
        this.art = Objects.requireNonNull(art, "Entity art cannot be null.");
        this.placement = Objects.requireNonNull(placement, "Entity placement cannot be null.");
    }

    /**
     * Creates a single-cell player drawn with the kind's default symbol.
     * @param id A unique id.
     * @param grid The starting grid.
     * @param cell The starting cell.
     * @return The player entity.
     */
    public static Entity player(int id, Grid grid, Cell cell) {
        return new Entity(id, EntityKind.PLAYER, Art.of(EntityKind.PLAYER.getDefaultSymbol()), new Placement(grid, cell));
    }

    /**
     * Creates an editor element.
     * @param id A unique id.
     * @param grid The grid it is placed on.
     * @param cell The top-left cell of its art.
     * @param art The art text.
     * @return The element entity.
     */
    public static Entity element(int id, Grid grid, Cell cell, String art) {
        return new Entity(id, EntityKind.ELEMENT, Art.parse(art), new Placement(grid, cell));
    }

    /**
     * Replaces the placement in a single assignment and notifies listeners.
     * @param next The new placement.
     */
    public void relocate(Placement next) {
        Objects.requireNonNull(next, "Placement cannot be null.");
        Placement previous = this.placement;
        this.placement = next;
        for (PlacementListener listener : listeners) {
            listener.onPlacementChanged(this, previous, next);
        }
    }

    public void addPlacementListener(PlacementListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removePlacementListener(PlacementListener listener) {
        listeners.remove(listener);
    }

    public int getId() {
        return id;
    }

    public EntityKind getKind() {
        return kind;
    }

    public Art getArt() {
        return art;
    }

    public Placement getPlacement() {
        return placement;
    }

    public Grid getGrid() {
        return placement.grid();
    }

    public Cell getPosition() {
        return placement.cell();
    }

    /**
     * Gets the movement envelope.
     * @return The bounds, or null if the entity may move anywhere on its grid.
     */
    public Bounds getBounds() {
        return bounds;
    }

    public void setBounds(Bounds bounds) {
        this.bounds = bounds;
    }

    @Override
    public String toString() {
        return "Entity{" + id + ", " + kind + ", " + placement + "}";
    }
}
