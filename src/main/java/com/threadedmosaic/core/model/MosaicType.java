package com.threadedmosaic.core.model;

/**
 * How each tile of the master image is replaced in the output.
 */
public enum MosaicType {
    /** Solid fill with the tile's average color. */
    COLOR,
    /** Random seed image tinted with the tile's average color. */
    HUE,
    /** Seed image whose average color is closest to the tile's. */
    PHOTO;

    public boolean requiresSeeds() {
        return this != COLOR;
    }
}
