package org.gridrealm.runtime.api;

/**
 * Thrown when a read or write addresses a cell outside the grid's dimensions.
 * <p>
 * Movement code treats this as a blocked move rather than letting it reach the host.
 */
public class OutOfBoundsException extends GridException {

    private final int row;
    private final int col;

    /**
     * Creates a new OutOfBoundsException for the given coordinate.
     *
     * @param row the offending row.
     * @param col the offending column.
     * @param width the grid width.
     * @param height the grid height.
     */
    public OutOfBoundsException(int row, int col, int width, int height) {
        super(String.format("Cell (%d, %d) is outside grid of width %d and height %d", row, col, width, height));
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }
}
