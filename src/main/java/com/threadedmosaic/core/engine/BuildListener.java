package com.threadedmosaic.core.engine;

import java.awt.image.BufferedImage;

/**
 * Optional hooks into a build's intermediate state.
 */
public interface BuildListener {

    BuildListener NONE = new BuildListener() { };

    default void gridCalculated(int tileCount) { }

    /**
     * Called once with the output canvas before any tile is painted. The canvas keeps changing
     * until the build returns; readers should copy it.
     */
    default void canvasCreated(BufferedImage canvas) { }
}
