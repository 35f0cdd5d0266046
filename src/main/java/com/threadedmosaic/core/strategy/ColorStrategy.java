package com.threadedmosaic.core.strategy;

import com.threadedmosaic.core.model.Rgb;
import com.threadedmosaic.core.model.Tile;
import com.threadedmosaic.core.seed.SeedCatalog;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Fills each tile with its average color.
 */
public class ColorStrategy implements MosaicStrategy {

    @Override
    public BufferedImage render(Tile tile, Rgb tileColor, SeedCatalog seeds) {
        var out = new BufferedImage(tile.width(), tile.height(), BufferedImage.TYPE_INT_RGB);
        int[] pixels = new int[tile.width() * tile.height()];
        Arrays.fill(pixels, tileColor.toArgb());
        out.setRGB(0, 0, tile.width(), tile.height(), pixels, 0, tile.width());
        return out;
    }

    @Override
    public boolean requiresSeeds() {
        return false;
    }
}
