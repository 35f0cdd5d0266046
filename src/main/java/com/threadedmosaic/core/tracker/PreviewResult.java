package com.threadedmosaic.core.tracker;

/**
 * Preview lookup. {@code data} and {@code format} are set only when {@link Status#AVAILABLE}.
 */
public record PreviewResult(Status status, byte[] data, String format) {

    public enum Status { AVAILABLE, NOT_AVAILABLE, NOT_FOUND }

    public static PreviewResult available(byte[] data, String format) {
        return new PreviewResult(Status.AVAILABLE, data, format);
    }

    public static PreviewResult notAvailable() {
        return new PreviewResult(Status.NOT_AVAILABLE, null, null);
    }

    public static PreviewResult notFound() {
        return new PreviewResult(Status.NOT_FOUND, null, null);
    }
}
