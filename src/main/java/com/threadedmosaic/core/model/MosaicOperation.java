package com.threadedmosaic.core.model;

import java.time.Instant;

/**
 * Immutable snapshot of a tracked mosaic operation.
 *
 * @param id                    opaque operation id
 * @param status                current lifecycle status
 * @param mosaicType            requested strategy
 * @param progressPercent       0..100, never decreases between snapshots
 * @param currentStep           free-text description of the current phase
 * @param resultPath            output file; set only when {@link OperationStatus#COMPLETED}
 * @param errorMessage          failure reason; set only when {@link OperationStatus#FAILED}
 * @param cancellationRequested whether a cancel has been requested
 * @param tileCount             number of tiles in the grid, 0 until known
 * @param createdAt             when the request was accepted
 * @param startedAt             when the build task began (nullable)
 * @param completedAt           when a terminal state was reached (nullable)
 */
public record MosaicOperation(
    String id,
    OperationStatus status,
    MosaicType mosaicType,
    int progressPercent,
    String currentStep,
    String resultPath,
    String errorMessage,
    boolean cancellationRequested,
    int tileCount,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt
) {}
