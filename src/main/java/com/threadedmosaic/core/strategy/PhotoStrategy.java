package com.threadedmosaic.core.strategy;

import com.threadedmosaic.core.image.ImageOps;
import com.threadedmosaic.core.model.Rgb;
import com.threadedmosaic.core.model.Tile;
import com.threadedmosaic.core.seed.SeedCatalog;
import com.threadedmosaic.core.seed.SeedImage;

import java.awt.image.BufferedImage;

/**
 * Paints the seed whose average color is closest to the tile color, unmodified.
 * <p>
 * With a reuse cap, seeds that already filled {@code maxUses} tiles are passed over for the
 * next nearest one. A capped instance keeps per-build counts and must not be shared.
 */
public class PhotoStrategy implements MosaicStrategy {

    private final SeedReuseLimit reuseLimit;

    public PhotoStrategy() {
        this.reuseLimit = null;
    }

    public PhotoStrategy(int maxUses) {
        this.reuseLimit = new SeedReuseLimit(maxUses);
    }

    @Override
    public BufferedImage render(Tile tile, Rgb tileColor, SeedCatalog seeds) {
        SeedImage seed = reuseLimit == null
                ? seeds.closestMatch(tileColor)
                : reuseLimit.claim(tileColor, seeds);
        return ImageOps.snapshot(seeds.patch(seed, tile.width(), tile.height()));
    }

    @Override
    public boolean requiresSeeds() {
        return true;
    }
}
