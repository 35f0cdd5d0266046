package com.threadedmosaic.core.strategy;

import com.threadedmosaic.core.model.Rgb;
import com.threadedmosaic.core.model.Tile;
import com.threadedmosaic.core.seed.SeedCatalog;
import com.threadedmosaic.core.seed.SeedImage;

import java.awt.image.BufferedImage;

/**
 * Paints a random seed and tints it toward the tile color.
 * <p>
 * The tile color is blended over the seed at {@link #ALPHA}/255 per channel:
 * {@code out = round((ALPHA * overlay + (255 - ALPHA) * seed) / 255)}.
 */
public class HueStrategy implements MosaicStrategy {

    public static final int ALPHA = 210;

    @Override
    public BufferedImage render(Tile tile, Rgb tileColor, SeedCatalog seeds) {
        SeedImage seed = seeds.randomSeed();
        BufferedImage patch = seeds.patch(seed, tile.width(), tile.height());

        int w = tile.width();
        int h = tile.height();
        int[] pixels = patch.getRGB(0, 0, w, h, null, 0, w);
        for (int i = 0; i < pixels.length; i++) {
            int p = pixels[i];
            int r = blend(tileColor.r(), (p >> 16) & 0xFF);
            int g = blend(tileColor.g(), (p >> 8) & 0xFF);
            int b = blend(tileColor.b(), p & 0xFF);
            pixels[i] = 0xFF000000 | (r << 16) | (g << 8) | b;
        }

        var out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, w, h, pixels, 0, w);
        return out;
    }

    static int blend(int overlay, int base) {
        return Math.round((ALPHA * overlay + (255 - ALPHA) * base) / 255f);
    }

    @Override
    public boolean requiresSeeds() {
        return true;
    }
}
