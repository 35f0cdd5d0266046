package com.threadedmosaic.core.model;

/**
 * One cell of the mosaic grid, expressed in master-image pixel space.
 *
 * @param index  row-major position in the grid
 * @param column zero-based grid column
 * @param row    zero-based grid row
 * @param x      left edge in pixels
 * @param y      top edge in pixels
 * @param width  width in pixels, always &gt; 0
 * @param height height in pixels, always &gt; 0
 */
public record Tile(int index, int column, int row, int x, int y, int width, int height) {

    public int area() {
        return width * height;
    }

    public boolean contains(int px, int py) {
        return px >= x && px < x + width && py >= y && py < y + height;
    }
}
