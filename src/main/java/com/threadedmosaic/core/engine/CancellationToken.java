package com.threadedmosaic.core.engine;

/**
 * Polled by the builder between units of work.
 */
@FunctionalInterface
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();
}
