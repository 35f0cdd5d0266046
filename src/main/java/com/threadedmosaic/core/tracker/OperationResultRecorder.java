package com.threadedmosaic.core.tracker;

import com.threadedmosaic.core.model.MosaicOperation;

/**
 * Optional hook that receives every operation once it reaches a terminal state.
 * Called on the operation's worker thread; implementations should return quickly.
 */
@FunctionalInterface
public interface OperationResultRecorder {

    void record(MosaicOperation terminalSnapshot);
}
