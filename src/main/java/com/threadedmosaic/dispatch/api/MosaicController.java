package com.threadedmosaic.dispatch.api;

import com.threadedmosaic.core.model.MosaicOperation;
import com.threadedmosaic.core.model.MosaicOptions;
import com.threadedmosaic.core.model.MosaicRequest;
import com.threadedmosaic.core.model.MosaicType;
import com.threadedmosaic.core.tracker.OperationTracker;
import com.threadedmosaic.core.tracker.PreviewResult;
import com.threadedmosaic.core.tracker.ResultLookup;
import com.threadedmosaic.core.tracker.SubmissionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for mosaic operations.
 */
@RestController
@RequestMapping("/api/v1/mosaics")
public class MosaicController {

    private static final Logger log = LoggerFactory.getLogger(MosaicController.class);

    private final OperationTracker tracker;
    private final SseStreamingService sseStreamingService;

    public MosaicController(OperationTracker tracker, SseStreamingService sseStreamingService) {
        this.tracker = tracker;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/mosaics: validate and enqueue a build.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestBody MosaicSubmitRequest body) {
        var errors = new ArrayList<String>();
        MosaicRequest request = toRequest(body, errors);
        if (!errors.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("errors", errors));
        }

        SubmissionResult result = tracker.submit(request);
        if (!result.accepted()) {
            return ResponseEntity.badRequest().body(Map.of("errors", result.errors()));
        }
        return ResponseEntity.accepted().body(Map.of(
                "operation_id", result.operationId(),
                "status", "QUEUED"
        ));
    }

    @GetMapping
    public ResponseEntity<List<MosaicResponse>> list() {
        return ResponseEntity.ok(tracker.listOperations().stream().map(MosaicResponse::from).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<MosaicResponse> status(@PathVariable String id) {
        return tracker.getStatus(id)
                .map(op -> ResponseEntity.ok(MosaicResponse.from(op)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/mosaics/{id}/cancel: 202 while active, 409 once terminal, 404 when unknown.
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<Map<String, String>> cancel(@PathVariable String id) {
        if (tracker.cancel(id)) {
            log.info("Cancellation requested via API for {}", id);
            return ResponseEntity.accepted().body(Map.of(
                    "operation_id", id,
                    "status", "CANCELLATION_REQUESTED"
            ));
        }
        Optional<MosaicOperation> op = tracker.getStatus(id);
        if (op.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.status(409).body(Map.of(
                "operation_id", id,
                "status", op.get().status().name(),
                "error", "Operation already finished"
        ));
    }

    @GetMapping("/{id}/preview")
    public ResponseEntity<byte[]> preview(@PathVariable String id) {
        PreviewResult preview = tracker.getPreview(id);
        return switch (preview.status()) {
            case AVAILABLE -> ResponseEntity.ok()
                    .contentType(MediaType.parseMediaType("image/" + preview.format()))
                    .body(preview.data());
            case NOT_AVAILABLE -> ResponseEntity.noContent().build();
            case NOT_FOUND -> ResponseEntity.notFound().build();
        };
    }

    @GetMapping("/{id}/result")
    public ResponseEntity<Map<String, String>> result(@PathVariable String id) {
        ResultLookup lookup = tracker.getResult(id);
        return switch (lookup.status()) {
            case READY -> ResponseEntity.ok(Map.of(
                    "operation_id", id,
                    "result_path", lookup.path().toString()
            ));
            case NOT_READY -> ResponseEntity.status(409).body(Map.of(
                    "operation_id", id,
                    "status", lookup.operationStatus().name(),
                    "error", "Result not ready"
            ));
            case NOT_FOUND -> ResponseEntity.notFound().build();
        };
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable String id) {
        return tracker.remove(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * GET /api/v1/mosaics/{id}/events: SSE stream of the operation's lifecycle events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public ResponseEntity<SseEmitter> events(@PathVariable String id) {
        if (tracker.getStatus(id).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(sseStreamingService.createEmitter(id));
    }

    private static MosaicRequest toRequest(MosaicSubmitRequest body, List<String> errors) {
        if (body == null) {
            errors.add("request body is required");
            return null;
        }
        MosaicType type = null;
        if (body.mosaicType() == null || body.mosaicType().isBlank()) {
            errors.add("mosaic_type is required");
        } else {
            try {
                type = MosaicType.valueOf(body.mosaicType().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                errors.add("Invalid mosaic_type: " + body.mosaicType());
            }
        }
        if (body.tileSize() == null) {
            errors.add("tile_size is required");
        }
        Path master = toPath("master_image_path", body.masterImagePath(), errors);
        Path seeds = toPath("seed_directory_path", body.seedDirectoryPath(), errors);
        Path output = toPath("output_path", body.outputPath(), errors);
        if (!errors.isEmpty()) {
            return null;
        }
        var options = new MosaicOptions(
                body.quality(),
                body.outputFormat() == null || body.outputFormat().isBlank() ? null : body.outputFormat(),
                body.thumbnailMaxWidth(),
                body.thumbnailMaxHeight(),
                Boolean.TRUE.equals(body.avoidImageRepetition()),
                body.maxImageReuse() == null ? 0 : body.maxImageReuse());
        return new MosaicRequest(master, seeds, body.tileSize(), type, output, options);
    }

    private static Path toPath(String field, String value, List<String> errors) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Path.of(value);
        } catch (InvalidPathException e) {
            errors.add("Invalid " + field + ": " + e.getMessage());
            return null;
        }
    }
}
