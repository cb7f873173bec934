package org.gridrealm.runtime.model;

import org.gridrealm.runtime.api.InvalidGridShapeException;
import org.gridrealm.runtime.api.OutOfBoundsException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A fixed-size, rectangular map of display symbols, one per cell.
 * <p>
 * Cells are stored in a flat row-major array. Every read and write is bounds-checked; there is
 * no wrap-around. A grid is never resized. Swapping maps means creating another grid.
 * <p>
 * The host may {@link #retire()} a grid once it is no longer in use. Transitions that still
 * point at a retired grid fail instead of relocating entities onto it.
 */
public class Grid {

    private final String name;
    private final int width;
    private final int height;
    private final char[] cells;
    private boolean retired = false;

    private Grid(String name, int width, int height, char[] cells) {
        this.name = name;
        this.width = width;
        this.height = height;
        this.cells = cells;
    }

    /**
     * Creates a grid with every cell set to the same symbol.
     *
     * @param name A name used in logs and for linking grids together.
     * @param width The number of columns, must be positive.
     * @param height The number of rows, must be positive.
     * @param fill The initial symbol of every cell.
     * @return The new grid.
     * @throws InvalidGridShapeException if a dimension is not positive.
     */
    public static Grid filled(String name, int width, int height, char fill) {
        Objects.requireNonNull(name, "Grid name cannot be null.");
        if (width <= 0 || height <= 0) {
            throw new InvalidGridShapeException("Grid dimensions must be positive, got " + width + "x" + height);
        }
        char[] cells = new char[width * height];
        Arrays.fill(cells, fill);
        return new Grid(name, width, height, cells);
    }

    /**
     * Creates a grid from textual rows.
     *
     * @param name A name used in logs and for linking grids together.
     * @param rows The rows, top to bottom. All rows must have the same non-zero length.
     * @return The new grid.
     * @throws InvalidGridShapeException if there are no rows or the rows differ in length.
     */
    public static Grid fromRows(String name, List<String> rows) {
        Objects.requireNonNull(name, "Grid name cannot be null.");
        Objects.requireNonNull(rows, "Rows cannot be null.");
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            throw new InvalidGridShapeException("Grid '" + name + "' must have at least one non-empty row");
        }
        int width = rows.get(0).length();
        int height = rows.size();
        char[] cells = new char[width * height];
        for (int r = 0; r < height; r++) {
            String row = rows.get(r);
            if (row.length() != width) {
                throw new InvalidGridShapeException(String.format(
                        "Grid '%s' row %d has length %d, expected %d", name, r, row.length(), width));
            }
            row.getChars(0, width, cells, r * width);
        }
        return new Grid(name, width, height, cells);
    }

    private int index(int row, int col) {
        if (!isInBounds(row, col)) {
            throw new OutOfBoundsException(row, col, width, height);
        }
        return row * width + col;
    }

    /**
     * Checks whether a coordinate addresses a cell of this grid.
     * @param row The row index.
     * @param col The column index.
     * @return true if {@code 0 <= row < height} and {@code 0 <= col < width}.
     */
    public boolean isInBounds(int row, int col) {
        return row >= 0 && row < height && col >= 0 && col < width;
    }

    public boolean isInBounds(Cell cell) {
        return isInBounds(cell.row(), cell.col());
    }

    /**
     * Gets the symbol at the specified coordinate.
     * @param row The row index.
     * @param col The column index.
     * @return The symbol stored in that cell.
     * @throws OutOfBoundsException if the coordinate is invalid.
     */
    public char get(int row, int col) {
        return cells[index(row, col)];
    }

    public char get(Cell cell) {
        return get(cell.row(), cell.col());
    }

    /**
     * Sets the symbol at the specified coordinate.
     * @param row The row index.
     * @param col The column index.
     * @param symbol The symbol to store.
     * @throws OutOfBoundsException if the coordinate is invalid.
     */
    public void set(int row, int col, char symbol) {
        cells[index(row, col)] = symbol;
    }

    public void set(Cell cell, char symbol) {
        set(cell.row(), cell.col(), symbol);
    }

    public Dimensions dimensions() {
        return new Dimensions(width, height);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the grid contents as one string per row, top to bottom.
     * @return An unmodifiable list of rows.
     */
    public List<String> rows() {
        List<String> rows = new ArrayList<>(height);
        for (int r = 0; r < height; r++) {
            rows.add(new String(cells, r * width, width));
        }
        return List.copyOf(rows);
    }

    /**
     * Counts the cells holding the given symbol.
     * @param symbol The symbol to count.
     * @return The number of matching cells.
     */
    public int count(char symbol) {
        int count = 0;
        for (char c : cells) {
            if (c == symbol) {
                count++;
            }
        }
        return count;
    }

    /**
     * Creates an independent copy with the same name and contents. The copy is not retired.
     * @return The copy.
     */
    public Grid copy() {
        return new Grid(name, width, height, cells.clone());
    }

    /**
     * Marks this grid as no longer in use by the host.
     */
    public void retire() {
        this.retired = true;
    }

    public boolean isRetired() {
        return retired;
    }

    /**
     * Compares cell contents only; name and lifecycle are ignored.
     * @param other The grid to compare with.
     * @return true if both grids have the same dimensions and symbols.
     */
    public boolean hasSameContent(Grid other) {
        return other != null && width == other.width && height == other.height
                && Arrays.equals(cells, other.cells);
    }

    @Override
    public String toString() {
        return "Grid{" + name + ", " + width + "x" + height + (retired ? ", retired" : "") + "}";
    }
}
