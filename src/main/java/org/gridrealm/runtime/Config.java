package org.gridrealm.runtime;

/**
 * Provides the default symbols and constants shared across the engine.
 * This final class contains static constants only. It is not meant to be instantiated.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * The symbol a maze is carved out of, and the default blocker.
     */
    public static final char WALL = '#';

    /**
     * The symbol of a walkable cell.
     */
    public static final char FLOOR = '.';

    /**
     * Frame symbols of a bordered room.
     */
    public static final char ROOM_WALL_HORIZONTAL = '═';
    public static final char ROOM_WALL_VERTICAL = '║';
    public static final char ROOM_CORNER_TOP_LEFT = '╔';
    public static final char ROOM_CORNER_TOP_RIGHT = '╗';
    public static final char ROOM_CORNER_BOTTOM_LEFT = '╚';
    public static final char ROOM_CORNER_BOTTOM_RIGHT = '╝';

    /**
     * The smallest width or height that still has an interior cell inside a one-cell border.
     */
    public static final int MIN_CARVABLE_DIMENSION = 3;
}
