package com.threadedmosaic.core.model;

/**
 * Lifecycle status of a mosaic operation.
 */
public enum OperationStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
