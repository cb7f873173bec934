package org.gridrealm.runtime.placement;

import org.gridrealm.runtime.api.Direction;

/**
 * Tagged editor actions. The host maps its own input to these values; the editor interprets them.
 */
public enum EditorCommand {
    MOVE_UP(Direction.UP),
    MOVE_DOWN(Direction.DOWN),
    MOVE_LEFT(Direction.LEFT),
    MOVE_RIGHT(Direction.RIGHT),
    SELECT_NEXT(null),
    SELECT_PREVIOUS(null);

    private final Direction direction;

    EditorCommand(Direction direction) {
        this.direction = direction;
    }

    /**
     * Gets the direction a move command stands for.
     * @return The direction, or null for selection commands.
     */
    public Direction getDirection() {
        return direction;
    }

    public boolean isMove() {
        return direction != null;
    }
}
