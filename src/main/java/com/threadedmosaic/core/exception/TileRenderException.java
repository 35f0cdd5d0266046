package com.threadedmosaic.core.exception;

/**
 * Wraps an unexpected failure while rendering a single tile. Aborts the whole build.
 */
public class TileRenderException extends MosaicException {

    private final int tileIndex;

    public TileRenderException(int tileIndex, Throwable cause) {
        super("Tile " + tileIndex + " failed: " + describe(cause), cause);
        this.tileIndex = tileIndex;
    }

    public int getTileIndex() {
        return tileIndex;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
