package com.threadedmosaic.core.exception;

/**
 * Base type for every failure raised by the mosaic engine.
 */
public abstract class MosaicException extends RuntimeException {

    protected MosaicException(String message) {
        super(message);
    }

    protected MosaicException(String message, Throwable cause) {
        super(message, cause);
    }
}
