package org.gridrealm.runtime.model;

/**
 * A grid coordinate in row-major order with the origin at the top-left corner.
 *
 * @param row The row index.
 * @param col The column index.
 */
public record Cell(int row, int col) {

    /**
     * Returns the cell displaced by the given deltas. The result is not bounds-checked.
     *
     * @param rowDelta rows to add.
     * @param colDelta columns to add.
     * @return the displaced cell.
     */
    public Cell offset(int rowDelta, int colDelta) {
        return new Cell(row + rowDelta, col + colDelta);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
