package com.threadedmosaic.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.threadedmosaic.core.model.MosaicOperation;
import com.threadedmosaic.core.model.MosaicOptions;
import com.threadedmosaic.core.model.MosaicRequest;
import com.threadedmosaic.core.model.MosaicType;
import com.threadedmosaic.core.model.OperationStatus;
import com.threadedmosaic.core.tracker.OperationTracker;
import com.threadedmosaic.core.tracker.PreviewResult;
import com.threadedmosaic.core.tracker.ResultLookup;
import com.threadedmosaic.core.tracker.SubmissionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MosaicController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class MosaicControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private OperationTracker tracker;

    @MockitoBean
    private SseStreamingService sseStreamingService;

    private static MosaicOperation operation(String id, OperationStatus status) {
        return new MosaicOperation(id, status, MosaicType.HUE, 40, "analyzing tile 4 of 10",
                null, null, false, 10, Instant.parse("2026-01-01T00:00:00Z"), null, null);
    }

    // ── POST /api/v1/mosaics ────────────────────────────────────────

    @Test
    @DisplayName("POST /mosaics returns 202 Accepted with operation_id")
    void submit() throws Exception {
        when(tracker.submit(any())).thenReturn(SubmissionResult.accepted("op-1"));

        String body = objectMapper.writeValueAsString(
                new MosaicSubmitRequest("/img/master.jpg", "/img/seeds", 20, "hue", "/out/m.jpg",
                        null, null, null, null, null, null));

        mockMvc.perform(post("/api/v1/mosaics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.operation_id").value("op-1"))
                .andExpect(jsonPath("$.status").value("QUEUED"));

        var captor = ArgumentCaptor.forClass(MosaicRequest.class);
        verify(tracker).submit(captor.capture());
        assertEquals(MosaicType.HUE, captor.getValue().mosaicType());
        assertEquals(Path.of("/img/seeds"), captor.getValue().seedDirectoryPath());
        assertEquals(20, captor.getValue().tileSize());
        assertEquals(MosaicOptions.DEFAULTS, captor.getValue().options());
    }

    @Test
    @DisplayName("POST /mosaics carries output, preview and seed reuse overrides")
    void submitWithOptions() throws Exception {
        when(tracker.submit(any())).thenReturn(SubmissionResult.accepted("op-2"));
        String body = """
                {"master_image_path":"/m.png","seed_directory_path":"/seeds","tile_size":10,
                 "mosaic_type":"photo","output_path":"/o.img","quality":60,"output_format":"jpg",
                 "thumbnail_max_width":120,"thumbnail_max_height":90,
                 "avoid_image_repetition":true,"max_image_reuse":2}
                """;

        mockMvc.perform(post("/api/v1/mosaics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted());

        var captor = ArgumentCaptor.forClass(MosaicRequest.class);
        verify(tracker).submit(captor.capture());
        assertEquals(new MosaicOptions(60, "jpg", 120, 90, true, 2), captor.getValue().options());
    }

    @Test
    @DisplayName("POST /mosaics with unknown mosaic_type returns 400 without submitting")
    void submitBadType() throws Exception {
        String body = """
                {"master_image_path":"/m.png","tile_size":10,"mosaic_type":"PIXEL","output_path":"/o.png"}
                """;

        mockMvc.perform(post("/api/v1/mosaics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]", containsString("Invalid mosaic_type")));
        verify(tracker, never()).submit(any());
    }

    @Test
    @DisplayName("POST /mosaics without tile_size returns 400")
    void submitMissingTileSize() throws Exception {
        String body = """
                {"master_image_path":"/m.png","mosaic_type":"COLOR","output_path":"/o.png"}
                """;

        mockMvc.perform(post("/api/v1/mosaics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors", hasItem("tile_size is required")));
    }

    @Test
    @DisplayName("POST /mosaics returns validation errors from the tracker")
    void submitRejected() throws Exception {
        when(tracker.submit(any())).thenReturn(SubmissionResult.rejected(
                List.of("master image not found: /m.png", "tileSize must be between 1 and 1000, got 0")));
        String body = """
                {"master_image_path":"/m.png","tile_size":0,"mosaic_type":"COLOR","output_path":"/o.png"}
                """;

        mockMvc.perform(post("/api/v1/mosaics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors", hasSize(2)));
    }

    // ── GET /api/v1/mosaics ───────────────────────────────────────────

    @Test
    @DisplayName("GET /mosaics lists operations in snake_case")
    void list() throws Exception {
        when(tracker.listOperations()).thenReturn(List.of(operation("op-1", OperationStatus.RUNNING)));

        mockMvc.perform(get("/api/v1/mosaics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].operation_id").value("op-1"))
                .andExpect(jsonPath("$[0].progress_percent").value(40))
                .andExpect(jsonPath("$[0].mosaic_type").value("HUE"));
    }

    @Test
    @DisplayName("GET /mosaics/{id} returns 404 for unknown operation")
    void statusNotFound() throws Exception {
        when(tracker.getStatus("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/mosaics/nope"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /mosaics/{id} returns the snapshot")
    void statusFound() throws Exception {
        when(tracker.getStatus("op-1")).thenReturn(Optional.of(operation("op-1", OperationStatus.RUNNING)));

        mockMvc.perform(get("/api/v1/mosaics/op-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.current_step").value("analyzing tile 4 of 10"))
                .andExpect(jsonPath("$.tile_count").value(10));
    }

    // ── POST /api/v1/mosaics/{id}/cancel ─────────────────────────────

    @Test
    @DisplayName("POST /mosaics/{id}/cancel returns 202 while active")
    void cancelAccepted() throws Exception {
        when(tracker.cancel("op-1")).thenReturn(true);

        mockMvc.perform(post("/api/v1/mosaics/op-1/cancel"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("CANCELLATION_REQUESTED"));
    }

    @Test
    @DisplayName("POST /mosaics/{id}/cancel returns 409 once finished")
    void cancelConflict() throws Exception {
        when(tracker.cancel("op-1")).thenReturn(false);
        when(tracker.getStatus("op-1")).thenReturn(Optional.of(operation("op-1", OperationStatus.COMPLETED)));

        mockMvc.perform(post("/api/v1/mosaics/op-1/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    @DisplayName("POST /mosaics/{id}/cancel returns 404 for unknown operation")
    void cancelNotFound() throws Exception {
        when(tracker.cancel("nope")).thenReturn(false);
        when(tracker.getStatus("nope")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/mosaics/nope/cancel"))
                .andExpect(status().isNotFound());
    }

    // ── GET /api/v1/mosaics/{id}/preview ─────────────────────────────

    @Test
    @DisplayName("GET /mosaics/{id}/preview returns image bytes")
    void previewAvailable() throws Exception {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G'};
        when(tracker.getPreview("op-1")).thenReturn(PreviewResult.available(png, "png"));

        mockMvc.perform(get("/api/v1/mosaics/op-1/preview"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(png));
    }

    @Test
    @DisplayName("GET /mosaics/{id}/preview returns 204 before any preview exists")
    void previewNotAvailable() throws Exception {
        when(tracker.getPreview("op-1")).thenReturn(PreviewResult.notAvailable());

        mockMvc.perform(get("/api/v1/mosaics/op-1/preview"))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("GET /mosaics/{id}/preview returns 404 for unknown operation")
    void previewNotFound() throws Exception {
        when(tracker.getPreview("nope")).thenReturn(PreviewResult.notFound());

        mockMvc.perform(get("/api/v1/mosaics/nope/preview"))
                .andExpect(status().isNotFound());
    }

    // ── GET /api/v1/mosaics/{id}/result ──────────────────────────────

    @Test
    @DisplayName("GET /mosaics/{id}/result returns the output path when ready")
    void resultReady() throws Exception {
        when(tracker.getResult("op-1")).thenReturn(ResultLookup.ready(Path.of("/out/m.jpg")));

        mockMvc.perform(get("/api/v1/mosaics/op-1/result"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result_path").value(Path.of("/out/m.jpg").toString()));
    }

    @Test
    @DisplayName("GET /mosaics/{id}/result returns 409 while running")
    void resultNotReady() throws Exception {
        when(tracker.getResult("op-1")).thenReturn(ResultLookup.notReady(OperationStatus.RUNNING));

        mockMvc.perform(get("/api/v1/mosaics/op-1/result"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.error").value("Result not ready"));
    }

    // ── DELETE /api/v1/mosaics/{id} ──────────────────────────────────

    @Test
    @DisplayName("DELETE /mosaics/{id} returns 204, then 404")
    void deleteOperation() throws Exception {
        when(tracker.remove("op-1")).thenReturn(true, false);

        mockMvc.perform(delete("/api/v1/mosaics/op-1"))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/v1/mosaics/op-1"))
                .andExpect(status().isNotFound());
    }

    // ── GET /api/v1/mosaics/{id}/events ──────────────────────────────

    @Test
    @DisplayName("GET /mosaics/{id}/events returns 404 for unknown operation")
    void sseNotFound() throws Exception {
        when(tracker.getStatus("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/mosaics/nope/events"))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /mosaics/{id}/events returns SSE emitter for known operation")
    void sseReturnsEmitter() throws Exception {
        when(tracker.getStatus("op-1")).thenReturn(Optional.of(operation("op-1", OperationStatus.RUNNING)));
        when(sseStreamingService.createEmitter("op-1")).thenReturn(new SseEmitter(0L));

        mockMvc.perform(get("/api/v1/mosaics/op-1/events"))
                .andExpect(status().isOk());
    }
}
