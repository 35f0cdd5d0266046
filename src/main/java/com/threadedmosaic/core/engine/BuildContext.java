package com.threadedmosaic.core.engine;

/**
 * Per-build collaborators handed to {@link MosaicBuilder#build}.
 *
 * @param operationId  id used in progress reports and log context
 * @param progressSink receives serialized, non-decreasing progress
 * @param cancellation polled before each tile and around the final write
 * @param listener     grid and canvas hooks
 */
public record BuildContext(
    String operationId,
    ProgressSink progressSink,
    CancellationToken cancellation,
    BuildListener listener
) {

    public BuildContext {
        progressSink = progressSink != null ? progressSink : ProgressSink.NONE;
        cancellation = cancellation != null ? cancellation : CancellationToken.NONE;
        listener = listener != null ? listener : BuildListener.NONE;
    }

    public static BuildContext of(String operationId) {
        return new BuildContext(operationId, null, null, null);
    }
}
