package com.threadedmosaic.core.color;

import com.threadedmosaic.core.model.Rgb;
import com.threadedmosaic.core.model.Tile;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Average-color and RGB distance computations.
 * <p>
 * Reads pixels through {@link BufferedImage#getRGB(int, int, int, int, int[], int, int)},
 * which copies into a private buffer, so the source image is never modified or retained.
 */
@Component
public class ColorAnalyzer {

    /** Distance between black and white: {@code sqrt(3) * 255}. */
    public static final double MAX_DISTANCE = Math.sqrt(3) * 255;

    public Rgb averageColor(BufferedImage image) {
        return averageColor(image, 0, 0, image.getWidth(), image.getHeight());
    }

    public Rgb averageColor(BufferedImage image, Tile tile) {
        return averageColor(image, tile.x(), tile.y(), tile.width(), tile.height());
    }

    /**
     * Per-channel arithmetic mean over a rectangle, each channel rounded to the nearest integer.
     *
     * @throws IllegalArgumentException if the region is empty or falls outside the image
     */
    public Rgb averageColor(BufferedImage image, int x, int y, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region must be non-empty: " + width + "x" + height);
        }
        if (x < 0 || y < 0 || x + width > image.getWidth() || y + height > image.getHeight()) {
            throw new IllegalArgumentException(String.format(
                    "Region (%d,%d %dx%d) outside image %dx%d",
                    x, y, width, height, image.getWidth(), image.getHeight()));
        }

        long red = 0;
        long green = 0;
        long blue = 0;
        // one row at a time keeps the scratch buffer small for large regions
        int[] row = new int[width];
        for (int dy = 0; dy < height; dy++) {
            image.getRGB(x, y + dy, width, 1, row, 0, width);
            for (int argb : row) {
                red += (argb >> 16) & 0xFF;
                green += (argb >> 8) & 0xFF;
                blue += argb & 0xFF;
            }
        }

        double count = (double) width * height;
        return new Rgb(
                (int) Math.round(red / count),
                (int) Math.round(green / count),
                (int) Math.round(blue / count));
    }

    /**
     * Euclidean distance between two colors in RGB space.
     */
    public double distance(Rgb a, Rgb b) {
        int dr = a.r() - b.r();
        int dg = a.g() - b.g();
        int db = a.b() - b.b();
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }
}
