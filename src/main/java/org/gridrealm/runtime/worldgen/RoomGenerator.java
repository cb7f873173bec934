package org.gridrealm.runtime.worldgen;

import org.gridrealm.runtime.Config;
import org.gridrealm.runtime.model.Grid;

/**
 * Fills a grid with a single room: a floor surrounded by a box-drawing frame.
 */
public class RoomGenerator implements IGridGenerator {

    private final char floor;

    public RoomGenerator() {
        this(Config.FLOOR);
    }

    public RoomGenerator(char floor) {
        this.floor = floor;
    }

    @Override
    public void generate(Grid grid) {
        int width = grid.getWidth();
        int height = grid.getHeight();
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                char symbol;
                if (r == 0 || r == height - 1) {
                    symbol = Config.ROOM_WALL_HORIZONTAL;
                } else if (c == 0 || c == width - 1) {
                    symbol = Config.ROOM_WALL_VERTICAL;
                } else {
                    symbol = floor;
                }
                grid.set(r, c, symbol);
            }
        }
        grid.set(0, 0, Config.ROOM_CORNER_TOP_LEFT);
        grid.set(0, width - 1, Config.ROOM_CORNER_TOP_RIGHT);
        grid.set(height - 1, 0, Config.ROOM_CORNER_BOTTOM_LEFT);
        grid.set(height - 1, width - 1, Config.ROOM_CORNER_BOTTOM_RIGHT);
    }
}
