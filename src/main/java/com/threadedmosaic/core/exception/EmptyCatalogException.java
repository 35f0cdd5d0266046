package com.threadedmosaic.core.exception;

import java.nio.file.Path;

/**
 * Thrown when a seed catalog has no usable images but a strategy needs one.
 */
public class EmptyCatalogException extends ImageResourceException {

    public EmptyCatalogException(Path seedDirectory) {
        super(seedDirectory == null ? "No usable seed images" : "No usable seed images in " + seedDirectory,
                seedDirectory);
    }
}
