package org.gridrealm.runtime.placement;

import org.gridrealm.runtime.Config;
import org.gridrealm.runtime.api.InvalidGridShapeException;
import org.gridrealm.runtime.api.MoveResult;
import org.gridrealm.runtime.collision.BlockerSet;
import org.gridrealm.runtime.collision.CollisionIndex;
import org.gridrealm.runtime.collision.EntityRegistry;
import org.gridrealm.runtime.model.Bounds;
import org.gridrealm.runtime.model.Cell;
import org.gridrealm.runtime.model.Entity;
import org.gridrealm.runtime.model.Grid;
import org.gridrealm.runtime.worldgen.RoomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A bordered room in which draggable elements can be added, selected and moved around.
 * <p>
 * Every element is confined to the room's interior. Elements may overlap each other; the one
 * added last is drawn on top.
 */
public class GridEditor {

    private static final Logger LOG = LoggerFactory.getLogger(GridEditor.class);

    private final Grid grid;
    private final Bounds interior;
    private final BlockerSet blockers;
    private final EntityRegistry registry = new EntityRegistry();
    private final CollisionIndex collisions = new CollisionIndex(registry);
    private final FootprintLayers layers = new FootprintLayers(registry, new ElementPlacer());
    private final List<Entity> elements = new ArrayList<>();
    private int selectedIndex = 0;

    /**
     * Creates an editor with a framed room of the given size.
     * @param name The grid name.
     * @param width The room width including the frame, at least 3.
     * @param height The room height including the frame, at least 3.
     */
    public GridEditor(String name, int width, int height) {
        this(name, width, height, BlockerSet.none());
    }

    /**
     * Creates an editor with a framed room of the given size.
     * @param name The grid name.
     * @param width The room width including the frame, at least 3.
     * @param height The room height including the frame, at least 3.
     * @param blockers Symbols elements may not be dragged onto.
     */
    public GridEditor(String name, int width, int height, BlockerSet blockers) {
        if (width < Config.MIN_CARVABLE_DIMENSION || height < Config.MIN_CARVABLE_DIMENSION) {
            throw new InvalidGridShapeException("Editor room must be at least 3x3, got " + width + "x" + height);
        }
        this.grid = Grid.filled(name, width, height, Config.FLOOR);
        new RoomGenerator().generate(grid);
        this.interior = Bounds.interiorOf(grid.dimensions());
        this.blockers = Objects.requireNonNull(blockers, "Blocker set cannot be null.");
    }

    /**
     * Adds an element, confines it to the interior and draws it.
     * @param id A unique element id.
     * @param position The top-left cell of its art.
     * @param art The art text.
     * @return The element.
     */
    public Entity addElement(int id, Cell position, String art) {
        Entity element = Entity.element(id, grid, position, art);
        element.setBounds(interior);
        registry.add(element);
        elements.add(element);
        layers.redraw(grid, layers.liftFrom(grid, element));
        LOG.debug("Added element {} at {}", id, position);
        return element;
    }

    /**
     * Removes an element and erases its art. The selection is clamped to the remaining elements.
     * @param id The element id.
     * @return true if an element was removed.
     */
    public boolean removeElement(int id) {
        if (!registry.contains(id)) {
            return false;
        }
        Entity element = registry.get(id);
        List<Entity> lifted = layers.liftFrom(grid, element);
        registry.remove(id);
        elements.remove(element);
        layers.redraw(grid, lifted);
        if (selectedIndex >= elements.size()) {
            selectedIndex = Math.max(0, elements.size() - 1);
        }
        return true;
    }

    /**
     * Gets the currently selected element.
     * @return The selected element, or null if there are no elements.
     */
    public Entity getSelectedElement() {
        if (selectedIndex >= 0 && selectedIndex < elements.size()) {
            return elements.get(selectedIndex);
        }
        return null;
    }

    public void nextElement() {
        if (!elements.isEmpty()) {
            selectedIndex = (selectedIndex + 1) % elements.size();
        }
    }

    public void previousElement() {
        if (!elements.isEmpty()) {
            selectedIndex = Math.floorMod(selectedIndex - 1, elements.size());
        }
    }

    /**
     * Interprets an editor command.
     * @param command The command.
     * @return true if an element moved.
     */
    public boolean handle(EditorCommand command) {
        if (command.isMove()) {
            return moveSelected(command);
        }
        if (command == EditorCommand.SELECT_NEXT) {
            nextElement();
        } else {
            previousElement();
        }
        return false;
    }

    private boolean moveSelected(EditorCommand command) {
        Entity selected = getSelectedElement();
        if (selected == null) {
            return false;
        }
        List<Entity> lifted = layers.liftFrom(grid, selected);
        MoveResult result = collisions.attemptMove(selected, command.getDirection(), blockers);
        layers.redraw(grid, lifted);
        return result == MoveResult.MOVED;
    }

    public Grid getGrid() {
        return grid;
    }

    public List<Entity> getElements() {
        return Collections.unmodifiableList(elements);
    }

    public int getSelectedIndex() {
        return selectedIndex;
    }
}
