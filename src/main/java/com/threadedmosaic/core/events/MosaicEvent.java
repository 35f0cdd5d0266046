package com.threadedmosaic.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while an operation moves through its lifecycle, used for SSE streaming
 * and the CLI follow mode.
 *
 * @param eventType   event type (e.g. "operation.submitted", "operation.progress", "operation.completed")
 * @param operationId the operation this event belongs to
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record MosaicEvent(
    String eventType,
    String operationId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String SUBMITTED = "operation.submitted";
    public static final String STARTED = "operation.started";
    public static final String PROGRESS = "operation.progress";
    public static final String COMPLETED = "operation.completed";
    public static final String FAILED = "operation.failed";
    public static final String CANCELLED = "operation.cancelled";

    public static MosaicEvent of(String eventType, String operationId, Map<String, Object> payload) {
        return new MosaicEvent(eventType, operationId, payload, Instant.now());
    }

    /**
     * True for the three events that close an operation's stream.
     */
    public boolean isTerminal() {
        return COMPLETED.equals(eventType) || FAILED.equals(eventType) || CANCELLED.equals(eventType);
    }
}
