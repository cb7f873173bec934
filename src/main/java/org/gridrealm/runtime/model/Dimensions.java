package org.gridrealm.runtime.model;

/**
 * Width and height of a grid.
 *
 * @param width number of columns.
 * @param height number of rows.
 */
public record Dimensions(int width, int height) {
}
