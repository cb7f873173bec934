package org.gridrealm.runtime.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * The glyph an entity draws onto a grid: a single symbol or a block of text lines.
 * <p>
 * A leading and a trailing empty line are dropped, so art written as a text block that starts
 * on a new line is anchored at its first visible row. Spaces are transparent: they are neither
 * drawn nor part of a footprint. Lines may differ in length.
 */
public final class Art {

    /** The transparent symbol. */
    public static final char TRANSPARENT = ' ';

    private final List<String> lines;
    private final int width;

    private Art(List<String> lines) {
        this.lines = List.copyOf(lines);
        int w = 0;
        for (String line : this.lines) {
            w = Math.max(w, line.length());
        }
        this.width = w;
    }

    /**
     * Creates single-cell art.
     * @param symbol The symbol.
     * @return The art.
     */
    public static Art of(char symbol) {
        return new Art(List.of(String.valueOf(symbol)));
    }

    /**
     * Parses multi-line art, splitting on {@code \n}.
     * @param text The art text.
     * @return The art.
     */
    public static Art parse(String text) {
        Objects.requireNonNull(text, "Art text cannot be null.");
        List<String> lines = new ArrayList<>(Arrays.asList(text.split("\n", -1)));
        if (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return new Art(lines);
    }

    public List<String> getLines() {
        return lines;
    }

    public int getHeight() {
        return lines.size();
    }

    public int getWidth() {
        return width;
    }

    /**
     * Returns the symbol at an art-relative offset, or {@link #TRANSPARENT} beyond a short line.
     * @param row The art row.
     * @param col The art column.
     * @return The symbol.
     */
    public char symbolAt(int row, int col) {
        String line = lines.get(row);
        return col < line.length() ? line.charAt(col) : TRANSPARENT;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Art other && lines.equals(other.lines);
    }

    @Override
    public int hashCode() {
        return lines.hashCode();
    }

    @Override
    public String toString() {
        return String.join("\n", lines);
    }
}
