package com.threadedmosaic.core.grid;

import com.threadedmosaic.core.model.Tile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions an image into a row-major grid of tiles.
 * <p>
 * Interior tiles are exactly {@code tileSize} square. The last column and the last row
 * take whatever remains, so the union of all tiles covers the image with no overlap.
 */
@Component
public class TileGridCalculator {

    /**
     * Computes the tile grid for an image.
     *
     * @param imageWidth  image width in pixels, &ge; 1
     * @param imageHeight image height in pixels, &ge; 1
     * @param tileSize    requested tile edge in pixels, &ge; 1
     * @return tiles in row-major order, {@code ceil(W/S) * ceil(H/S)} of them
     * @throws IllegalArgumentException if any argument is &le; 0
     */
    public List<Tile> calculate(int imageWidth, int imageHeight, int tileSize) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException(
                    "Image dimensions must be positive: " + imageWidth + "x" + imageHeight);
        }
        if (tileSize <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileSize);
        }

        int columns = columns(imageWidth, tileSize);
        int rows = rows(imageHeight, tileSize);
        int lastWidth = imageWidth - tileSize * (columns - 1);
        int lastHeight = imageHeight - tileSize * (rows - 1);

        int count;
        try {
            count = Math.multiplyExact(columns, rows);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Grid of " + columns + "x" + rows + " tiles is too large", e);
        }
        var tiles = new ArrayList<Tile>(count);
        for (int row = 0; row < rows; row++) {
            int height = row == rows - 1 ? lastHeight : tileSize;
            for (int column = 0; column < columns; column++) {
                int width = column == columns - 1 ? lastWidth : tileSize;
                tiles.add(new Tile(row * columns + column, column, row,
                        column * tileSize, row * tileSize, width, height));
            }
        }
        return List.copyOf(tiles);
    }

    public int columns(int imageWidth, int tileSize) {
        return ceilDiv(imageWidth, tileSize);
    }

    public int rows(int imageHeight, int tileSize) {
        return ceilDiv(imageHeight, tileSize);
    }

    public int tileCount(int imageWidth, int imageHeight, int tileSize) {
        return columns(imageWidth, tileSize) * rows(imageHeight, tileSize);
    }

    private static int ceilDiv(int value, int divisor) {
        // value + divisor - 1 overflows for values near Integer.MAX_VALUE
        return (value - 1) / divisor + 1;
    }
}
