package com.threadedmosaic.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.threadedmosaic.core.model.MosaicOperation;

import java.time.Instant;

/**
 * JSON view of a tracked operation.
 */
public record MosaicResponse(
    @JsonProperty("operation_id") String operationId,
    String status,
    @JsonProperty("mosaic_type") String mosaicType,
    @JsonProperty("progress_percent") int progressPercent,
    @JsonProperty("current_step") String currentStep,
    @JsonProperty("result_path") String resultPath,
    @JsonProperty("error_message") String errorMessage,
    @JsonProperty("cancellation_requested") boolean cancellationRequested,
    @JsonProperty("tile_count") int tileCount,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("completed_at") Instant completedAt
) {

    public static MosaicResponse from(MosaicOperation op) {
        return new MosaicResponse(
                op.id(),
                op.status().name(),
                op.mosaicType().name(),
                op.progressPercent(),
                op.currentStep(),
                op.resultPath(),
                op.errorMessage(),
                op.cancellationRequested(),
                op.tileCount(),
                op.createdAt(),
                op.startedAt(),
                op.completedAt());
    }
}
