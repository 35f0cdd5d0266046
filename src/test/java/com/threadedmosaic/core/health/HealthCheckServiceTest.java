package com.threadedmosaic.core.health;

import com.threadedmosaic.core.model.MosaicOperation;
import com.threadedmosaic.core.model.MosaicType;
import com.threadedmosaic.core.model.OperationStatus;
import com.threadedmosaic.core.tracker.OperationTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static MosaicOperation operation(String id, OperationStatus status) {
        return new MosaicOperation(id, status, MosaicType.COLOR, 0, "queued", null, null, false, 0,
                NOW, null, null);
    }

    private static ThreadPoolExecutor pool(int threads) {
        return new ThreadPoolExecutor(threads, threads, 0, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>());
    }

    private static MosaicHealthReport report(ThreadPoolExecutor operations, ExecutorService tiles,
                                             OperationTracker tracker) {
        return new HealthCheckService(operations, tiles, tracker, CLOCK).report();
    }

    @Test
    @DisplayName("report lists codecs, operations, tiles and tracker with the check time")
    void componentsInOrder() {
        MosaicHealthReport report = report(null, null, null);

        assertEquals(List.of("codecs", "operations", "tiles", "tracker"),
                report.components().stream().map(ComponentHealth::component).toList());
        assertEquals(NOW, report.checkedAt());
    }

    @Test
    @DisplayName("missing pools and tracker make the whole report DOWN")
    void missingComponentsDown() {
        MosaicHealthReport report = report(null, null, null);

        assertTrue(report.isDown());
        assertEquals(ComponentHealth.Level.DOWN, report.component("operations").orElseThrow().level());
        assertEquals(ComponentHealth.Level.DOWN, report.component("tiles").orElseThrow().level());
        assertEquals(ComponentHealth.Level.DOWN, report.component("tracker").orElseThrow().level());
    }

    @Test
    @DisplayName("standard JDK writers cover every output format")
    void codecsUp() {
        ComponentHealth codecs = report(null, null, null).component("codecs").orElseThrow();

        assertEquals(ComponentHealth.Level.UP, codecs.level());
        assertEquals(5, codecs.gauges().get("writable"));
    }

    @Nested
    @DisplayName("worker pools")
    class PoolTests {

        @Test
        @DisplayName("idle pools are UP with thread, active and queued gauges")
        void idleUp() {
            var operations = pool(3);
            var tiles = pool(8);
            try {
                MosaicHealthReport report = report(operations, tiles, mock(OperationTracker.class));

                ComponentHealth ops = report.component("operations").orElseThrow();
                assertEquals(ComponentHealth.Level.UP, ops.level());
                assertEquals(List.of("threads", "active", "queued"), List.copyOf(ops.gauges().keySet()));
                assertEquals(3, ops.gauges().get("threads"));
                assertEquals(8, report.component("tiles").orElseThrow().gauges().get("threads"));
                assertEquals(ComponentHealth.Level.UP, report.overall());
            } finally {
                operations.shutdownNow();
                tiles.shutdownNow();
            }
        }

        @Test
        @DisplayName("all threads busy with work queued is DEGRADED, not DOWN")
        void saturatedDegraded() throws Exception {
            var operations = pool(1);
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            try {
                operations.execute(() -> {
                    started.countDown();
                    try {
                        release.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
                operations.execute(() -> { });
                assertTrue(started.await(5, TimeUnit.SECONDS));

                MosaicHealthReport report = report(operations, null, mock(OperationTracker.class));

                ComponentHealth ops = report.component("operations").orElseThrow();
                assertEquals(ComponentHealth.Level.DEGRADED, ops.level());
                assertEquals(1, ops.gauges().get("queued"));
                assertEquals("Operation pool saturated, 1 waiting", ops.detail());
            } finally {
                release.countDown();
                operations.shutdownNow();
            }
        }

        @Test
        @DisplayName("a shut-down pool is DOWN")
        void shutDown() {
            var tiles = pool(2);
            tiles.shutdown();

            ComponentHealth health = report(null, tiles, null).component("tiles").orElseThrow();

            assertEquals(ComponentHealth.Level.DOWN, health.level());
            assertEquals("Tile pool is shut down", health.detail());
        }
    }

    @Test
    @DisplayName("tracker gauges count operations per status")
    void trackerCounts() {
        var tracker = mock(OperationTracker.class);
        when(tracker.listOperations()).thenReturn(List.of(
                operation("a", OperationStatus.RUNNING),
                operation("b", OperationStatus.QUEUED),
                operation("c", OperationStatus.QUEUED),
                operation("d", OperationStatus.COMPLETED)));

        ComponentHealth health = report(null, null, tracker).component("tracker").orElseThrow();

        assertEquals(ComponentHealth.Level.UP, health.level());
        assertEquals("4 operations tracked", health.detail());
        assertEquals(1, health.gauges().get("running"));
        assertEquals(2, health.gauges().get("queued"));
        assertEquals(1, health.gauges().get("completed"));
        assertEquals(0, health.gauges().get("failed"));
    }

    @Test
    @DisplayName("overall level is the worst component level")
    void worstWins() {
        var up = new ComponentHealth("a", ComponentHealth.Level.UP, "ok", Map.of());
        var degraded = new ComponentHealth("b", ComponentHealth.Level.DEGRADED, "slow", Map.of());

        assertEquals(ComponentHealth.Level.UP, MosaicHealthReport.of(List.of(up), NOW).overall());
        assertEquals(ComponentHealth.Level.DEGRADED, MosaicHealthReport.of(List.of(up, degraded), NOW).overall());
        assertEquals(ComponentHealth.Level.UP, MosaicHealthReport.of(List.of(), NOW).overall());
    }
}
