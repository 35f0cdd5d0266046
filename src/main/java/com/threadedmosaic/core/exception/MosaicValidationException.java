package com.threadedmosaic.core.exception;

import java.util.List;

/**
 * Thrown when a mosaic request is malformed. Carries every problem found, not just the first.
 */
public class MosaicValidationException extends MosaicException {

    private final List<String> errors;

    public MosaicValidationException(List<String> errors) {
        super("Validation failed: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
