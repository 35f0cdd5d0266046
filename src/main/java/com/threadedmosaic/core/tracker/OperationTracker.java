package com.threadedmosaic.core.tracker;

import com.threadedmosaic.core.config.MosaicConfig;
import com.threadedmosaic.core.config.MosaicProperties;
import com.threadedmosaic.core.engine.BuildContext;
import com.threadedmosaic.core.engine.BuildListener;
import com.threadedmosaic.core.engine.MosaicBuilder;
import com.threadedmosaic.core.engine.ProgressSink;
import com.threadedmosaic.core.events.EventBus;
import com.threadedmosaic.core.events.MosaicEvent;
import com.threadedmosaic.core.exception.ImageResourceException;
import com.threadedmosaic.core.image.ImageIoService;
import com.threadedmosaic.core.image.ImageOps;
import com.threadedmosaic.core.logging.MdcContext;
import com.threadedmosaic.core.metrics.MosaicMetrics;
import com.threadedmosaic.core.model.MosaicOperation;
import com.threadedmosaic.core.model.MosaicOptions;
import com.threadedmosaic.core.model.MosaicRequest;
import com.threadedmosaic.core.model.MosaicResult;
import com.threadedmosaic.core.model.OperationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns every mosaic operation from submission to eviction.
 * <p>
 * Accepted requests run one per task on the operation executor and move through
 * {@code QUEUED -> RUNNING -> COMPLETED | FAILED | CANCELLED}. Every public method is safe to
 * call from any thread and none of them throws for an unknown id.
 */
@Service
public class OperationTracker {

    private static final Logger log = LoggerFactory.getLogger(OperationTracker.class);

    private final MosaicBuilder builder;
    private final MosaicRequestValidator validator;
    private final ImageIoService imageIo;
    private final ExecutorService operationExecutor;
    private final ProgressSink progressSink;
    private final EventBus eventBus;
    private final MosaicMetrics metrics;
    private final OperationResultRecorder recorder;
    private final Clock clock;

    private final int previewMaxWidth;
    private final int previewMaxHeight;
    private final String previewFormat;
    private final List<Integer> previewMilestones;
    private final Duration retentionWindow;
    private final Duration gracePeriod;

    private final ConcurrentHashMap<String, OperationRecord> operations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, byte[]> previewCache = new ConcurrentHashMap<>();

    @Autowired
    public OperationTracker(MosaicBuilder builder, MosaicRequestValidator validator, ImageIoService imageIo,
                            MosaicProperties properties,
                            @Qualifier(MosaicConfig.OPERATION_EXECUTOR) ExecutorService operationExecutor,
                            ProgressSink progressSink, EventBus eventBus,
                            @Autowired(required = false) MosaicMetrics metrics,
                            @Autowired(required = false) OperationResultRecorder recorder) {
        this(builder, validator, imageIo, properties, operationExecutor, progressSink, eventBus,
                metrics, recorder, Clock.systemUTC());
    }

    OperationTracker(MosaicBuilder builder, MosaicRequestValidator validator, ImageIoService imageIo,
                     MosaicProperties properties, ExecutorService operationExecutor,
                     ProgressSink progressSink, EventBus eventBus, MosaicMetrics metrics,
                     OperationResultRecorder recorder, Clock clock) {
        this.builder = builder;
        this.validator = validator;
        this.imageIo = imageIo;
        this.operationExecutor = operationExecutor;
        this.progressSink = progressSink != null ? progressSink : ProgressSink.NONE;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.recorder = recorder;
        this.clock = clock;
        this.previewMaxWidth = properties.getPreviewMaxWidth();
        this.previewMaxHeight = properties.getPreviewMaxHeight();
        this.previewFormat = properties.getPreviewFormat();
        this.previewMilestones = properties.getPreviewMilestones().stream().sorted().toList();
        this.retentionWindow = properties.getRetentionWindow();
        this.gracePeriod = properties.getGracePeriod();
    }

    // -- Submission ---------------------------------------------------------

    /**
     * Validates and enqueues a request. A rejected request leaves no trace in the tracker.
     */
    public SubmissionResult submit(MosaicRequest request) {
        List<String> errors = validator.validate(request);
        if (!errors.isEmpty()) {
            log.warn("Rejected mosaic request: {}", errors);
            recordSubmission(request, false);
            return SubmissionResult.rejected(errors);
        }

        String id = UUID.randomUUID().toString();
        var record = new OperationRecord(id, request, clock.instant());
        operations.put(id, record);
        try {
            operationExecutor.execute(() -> run(record));
        } catch (RejectedExecutionException e) {
            operations.remove(id);
            log.error("Operation executor rejected {}: {}", id, e.getMessage());
            recordSubmission(request, false);
            return SubmissionResult.rejected(List.of("operation executor is not accepting work"));
        }

        log.info("Accepted {} mosaic {} (tile size {})", request.mosaicType(), id, request.tileSize());
        recordSubmission(request, true);
        eventBus.publish(MosaicEvent.of(MosaicEvent.SUBMITTED, id, Map.of(
                "mosaicType", request.mosaicType().name(),
                "tileSize", request.tileSize())));
        return SubmissionResult.accepted(id);
    }

    // -- Queries ------------------------------------------------------------

    public Optional<MosaicOperation> getStatus(String id) {
        return Optional.ofNullable(operations.get(id)).map(OperationRecord::snapshot);
    }

    public List<MosaicOperation> listOperations() {
        return operations.values().stream()
                .map(OperationRecord::snapshot)
                .sorted(Comparator.comparing(MosaicOperation::createdAt))
                .toList();
    }

    public ResultLookup getResult(String id) {
        OperationRecord record = operations.get(id);
        if (record == null) {
            return ResultLookup.notFound();
        }
        OperationStatus status = record.status();
        if (status == OperationStatus.COMPLETED) {
            return ResultLookup.ready(Path.of(record.resultPath()));
        }
        return ResultLookup.notReady(status);
    }

    /**
     * Returns the cached thumbnail, or builds one from the live canvas (while running) or the
     * written file (once completed).
     */
    public PreviewResult getPreview(String id) {
        OperationRecord record = operations.get(id);
        if (record == null) {
            return PreviewResult.notFound();
        }
        byte[] cached = previewCache.get(id);
        if (cached != null) {
            return PreviewResult.available(cached, previewFormat);
        }

        try {
            switch (record.status()) {
                case RUNNING -> {
                    BufferedImage canvas = record.canvas();
                    if (canvas != null) {
                        return PreviewResult.available(cachePreview(record, canvas, "on-demand"), previewFormat);
                    }
                }
                case COMPLETED -> {
                    BufferedImage finalImage = imageIo.loadImage(Path.of(record.resultPath()));
                    return PreviewResult.available(cachePreview(record, finalImage, "on-demand"), previewFormat);
                }
                default -> { }
            }
        } catch (ImageResourceException e) {
            log.warn("Preview for {} unavailable: {}", id, e.getMessage());
        }
        return PreviewResult.notAvailable();
    }

    // -- Cancellation and eviction ------------------------------------------

    /**
     * Requests cancellation. Returns true while the operation is QUEUED or RUNNING, including
     * repeated calls; false once it is terminal or when the id is unknown.
     */
    public boolean cancel(String id) {
        OperationRecord record = operations.get(id);
        if (record == null || record.status().isTerminal()) {
            return false;
        }
        record.requestCancellation();
        log.info("Cancellation requested for {}", id);
        return true;
    }

    /**
     * Forgets an operation, cancelling it first when it is still active.
     */
    public boolean remove(String id) {
        OperationRecord record = operations.remove(id);
        if (record == null) {
            return false;
        }
        if (!record.status().isTerminal()) {
            record.requestCancellation();
        }
        previewCache.remove(id);
        log.info("Removed operation {}", id);
        return true;
    }

    @Scheduled(fixedDelayString = "${mosaic.retention.cleanup-interval:PT5M}",
            initialDelayString = "${mosaic.retention.cleanup-interval:PT5M}")
    public void evictExpired() {
        evictExpired(clock.instant());
    }

    /**
     * Drops terminal operations completed more than the grace period before {@code now} and
     * any operation created more than the retention window before it. Active operations past
     * retention are cancelled as they go.
     *
     * @return number of operations evicted
     */
    public int evictExpired(Instant now) {
        int evicted = 0;
        for (OperationRecord record : operations.values()) {
            boolean terminal = record.status().isTerminal();
            boolean pastGrace = terminal && record.completedAt() != null
                    && record.completedAt().plus(gracePeriod).isBefore(now);
            boolean pastRetention = record.createdAt().plus(retentionWindow).isBefore(now);
            if (!pastGrace && !pastRetention) {
                continue;
            }
            if (!terminal) {
                log.warn("Operation {} exceeded retention while {}; cancelling", record.id(), record.status());
                record.requestCancellation();
            }
            if (operations.remove(record.id(), record)) {
                previewCache.remove(record.id());
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} expired operations", evicted);
            if (metrics != null) {
                metrics.recordEvictions(evicted);
            }
        }
        return evicted;
    }

    // -- Execution ----------------------------------------------------------

    private void run(OperationRecord record) {
        String id = record.id();
        MdcContext.setOperation(id, record.request().mosaicType().name());
        try {
            if (record.isCancellationRequested()) {
                finishCancelled(record);
                return;
            }
            if (!record.start(clock.instant())) {
                return;
            }
            eventBus.publish(MosaicEvent.of(MosaicEvent.STARTED, id, Map.of()));

            var ctx = new BuildContext(id,
                    (opId, percent, step) -> onProgress(record, percent, step),
                    record::isCancellationRequested,
                    listenerFor(record));
            MosaicResult result = builder.build(record.request(), ctx);

            if (result.isCancelled()) {
                finishCancelled(record);
            } else {
                finishCompleted(record, result);
            }
        } catch (Throwable e) {
            // errors included, so an OutOfMemoryError cannot leave the operation RUNNING
            log.error("Operation {} failed: {}", id, e.getMessage(), e);
            finishFailed(record, describe(e));
        } finally {
            MdcContext.clear();
        }
    }

    private BuildListener listenerFor(OperationRecord record) {
        return new BuildListener() {
            @Override
            public void gridCalculated(int tileCount) {
                record.tileCount(tileCount);
            }

            @Override
            public void canvasCreated(BufferedImage canvas) {
                record.canvas(canvas);
            }
        };
    }

    private void onProgress(OperationRecord record, int percent, String step) {
        record.advance(percent, step);
        int milestone = record.crossMilestone(percent, previewMilestones);
        BufferedImage canvas = record.canvas();
        if (milestone > 0 && canvas != null) {
            try {
                cachePreview(record, canvas, "milestone-" + milestone);
            } catch (ImageResourceException e) {
                log.warn("Milestone preview at {}% failed: {}", milestone, e.getMessage());
            }
        }
        progressSink.report(record.id(), record.progress(), step);
    }

    private void finishCompleted(OperationRecord record, MosaicResult result) {
        BufferedImage canvas = record.canvas();
        if (canvas != null) {
            try {
                cachePreview(record, canvas, "completed");
            } catch (ImageResourceException e) {
                log.warn("Final preview failed: {}", e.getMessage());
            }
        }
        if (!record.complete(result.outputPath().toString(), clock.instant())) {
            return;
        }
        log.info("Operation {} completed: {}", record.id(), result.outputPath());
        if (metrics != null) {
            metrics.recordBuildDuration(record.request().mosaicType(), result.elapsed());
        }
        terminal(record, MosaicEvent.COMPLETED, Map.of(
                "resultPath", result.outputPath().toString(),
                "tileCount", result.tileCount(),
                "elapsedMs", result.elapsed().toMillis()));
    }

    private void finishCancelled(OperationRecord record) {
        if (record.cancel(clock.instant())) {
            log.info("Operation {} cancelled", record.id());
            terminal(record, MosaicEvent.CANCELLED, Map.of("progress", record.progress()));
        }
    }

    private void finishFailed(OperationRecord record, String message) {
        if (record.fail(message, clock.instant())) {
            terminal(record, MosaicEvent.FAILED, Map.of("error", message));
        }
    }

    private void terminal(OperationRecord record, String eventType, Map<String, Object> payload) {
        MosaicOperation snapshot = record.snapshot();
        if (metrics != null) {
            metrics.recordOperationResult(snapshot.mosaicType(), snapshot.status());
        }
        eventBus.publish(MosaicEvent.of(eventType, record.id(), payload));
        if (recorder != null) {
            try {
                recorder.record(snapshot);
            } catch (RuntimeException e) {
                log.warn("Result recorder failed for {}: {}", record.id(), e.getMessage(), e);
            }
        }
    }

    private byte[] cachePreview(OperationRecord record, BufferedImage source, String trigger) {
        MosaicOptions options = record.request().options();
        byte[] bytes = imageIo.thumbnail(ImageOps.snapshot(source),
                options.thumbnailMaxWidthOr(previewMaxWidth),
                options.thumbnailMaxHeightOr(previewMaxHeight),
                previewFormat);
        // the put happens under the operation's map entry, so a concurrent remove either runs
        // first and skips it or runs after and clears it
        operations.computeIfPresent(record.id(), (id, current) -> {
            if (current == record) {
                previewCache.put(id, bytes);
            }
            return current;
        });
        if (metrics != null) {
            metrics.recordPreviewGenerated(trigger);
        }
        return bytes;
    }

    private void recordSubmission(MosaicRequest request, boolean accepted) {
        if (metrics != null) {
            metrics.recordSubmission(request == null ? null : request.mosaicType(), accepted);
        }
    }

    boolean hasCachedPreview(String id) {
        return previewCache.containsKey(id);
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
