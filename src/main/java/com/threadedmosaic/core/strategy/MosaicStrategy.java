package com.threadedmosaic.core.strategy;

import com.threadedmosaic.core.model.Rgb;
import com.threadedmosaic.core.model.Tile;
import com.threadedmosaic.core.seed.SeedCatalog;

import java.awt.image.BufferedImage;

/**
 * Produces the pixels for one output tile.
 * <p>
 * Implementations are called concurrently from tile workers and hold no state beyond what
 * one build shares.
 */
public interface MosaicStrategy {

    /**
     * Renders a tile.
     *
     * @param tile      the grid cell being filled
     * @param tileColor average color of the master image inside {@code tile}
     * @param seeds     seed catalog; null when {@link #requiresSeeds()} is false
     * @return a new image of exactly {@code tile.width() x tile.height()}
     */
    BufferedImage render(Tile tile, Rgb tileColor, SeedCatalog seeds);

    boolean requiresSeeds();
}
