package com.threadedmosaic.core.tracker;

import com.threadedmosaic.core.model.OperationStatus;

import java.nio.file.Path;

/**
 * Result lookup. {@code path} is set only when {@link Status#READY}; {@code operationStatus}
 * is null only when {@link Status#NOT_FOUND}.
 */
public record ResultLookup(Status status, Path path, OperationStatus operationStatus) {

    public enum Status { READY, NOT_READY, NOT_FOUND }

    public static ResultLookup ready(Path path) {
        return new ResultLookup(Status.READY, path, OperationStatus.COMPLETED);
    }

    public static ResultLookup notReady(OperationStatus current) {
        return new ResultLookup(Status.NOT_READY, null, current);
    }

    public static ResultLookup notFound() {
        return new ResultLookup(Status.NOT_FOUND, null, null);
    }
}
