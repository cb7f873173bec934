package org.gridrealm.runtime.model;

/**
 * An inclusive rectangle restricting where an entity's anchor cell may move.
 *
 * @param minRow smallest allowed row.
 * @param minCol smallest allowed column.
 * @param maxRow largest allowed row.
 * @param maxCol largest allowed column.
 */
public record Bounds(int minRow, int minCol, int maxRow, int maxCol) {

    public Bounds {
        if (minRow > maxRow || minCol > maxCol) {
            throw new IllegalArgumentException("Empty bounds: rows " + minRow + ".." + maxRow
                    + ", cols " + minCol + ".." + maxCol);
        }
    }

    /**
     * Bounds covering the interior of a grid, i.e. everything except its one-cell border.
     *
     * @param dimensions the grid dimensions, at least 3x3.
     * @return the interior bounds.
     */
    public static Bounds interiorOf(Dimensions dimensions) {
        return new Bounds(1, 1, dimensions.height() - 2, dimensions.width() - 2);
    }

    public boolean contains(Cell cell) {
        return cell.row() >= minRow && cell.row() <= maxRow
                && cell.col() >= minCol && cell.col() <= maxCol;
    }
}
