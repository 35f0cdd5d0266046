package com.threadedmosaic.core.exception;

import java.nio.file.Path;

/**
 * Thrown when a file exists but no installed codec can decode or encode it.
 */
public class UnsupportedImageFormatException extends ImageResourceException {

    private final String format;

    public UnsupportedImageFormatException(String message, Path path, String format) {
        super(message, path);
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
