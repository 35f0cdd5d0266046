package com.threadedmosaic.core.exception;

import java.nio.file.Path;

/**
 * Thrown when an image file cannot be read or written.
 */
public class ImageResourceException extends MosaicException {

    private final Path path;

    public ImageResourceException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public ImageResourceException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
