package com.threadedmosaic.core.engine;

/**
 * Receives progress reports from a running build. Calls for one operation are serialized
 * and their percentages never decrease.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NONE = (operationId, percent, step) -> { };

    void report(String operationId, int percent, String step);
}
