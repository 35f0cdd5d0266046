package com.threadedmosaic.core.metrics;

import com.threadedmosaic.core.model.MosaicType;
import com.threadedmosaic.core.model.OperationStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for mosaic builds.
 */
@Service
public class MosaicMetrics {

    private final MeterRegistry registry;

    public MosaicMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSubmission(MosaicType type, boolean accepted) {
        Counter.builder("mosaic.submissions.total")
                .tag("type", type == null ? "unknown" : type.name())
                .tag("accepted", String.valueOf(accepted))
                .register(registry)
                .increment();
    }

    public void recordOperationResult(MosaicType type, OperationStatus status) {
        Counter.builder("mosaic.operations.total")
                .tag("type", type.name())
                .tag("status", status.name())
                .register(registry)
                .increment();
    }

    public void recordBuildDuration(MosaicType type, Duration elapsed) {
        Timer.builder("mosaic.build.duration")
                .tag("type", type.name())
                .register(registry)
                .record(elapsed);
    }

    public void recordTilesRendered(MosaicType type, int count) {
        Counter.builder("mosaic.tiles.rendered")
                .description("Tiles painted onto output canvases")
                .tag("type", type.name())
                .register(registry)
                .increment(count);
    }

    /**
     * Records how many seeds a catalog load produced and how many files were skipped.
     */
    public void recordSeedCatalog(int loaded, int skipped) {
        DistributionSummary.builder("mosaic.seeds.catalog_size")
                .description("Decoded seed images per catalog")
                .register(registry)
                .record(loaded);
        if (skipped > 0) {
            Counter.builder("mosaic.seeds.skipped")
                    .description("Seed files that failed to decode")
                    .register(registry)
                    .increment(skipped);
        }
    }

    public void recordPreviewGenerated(String trigger) {
        Counter.builder("mosaic.previews.generated")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
    }

    public void recordEvictions(int count) {
        if (count == 0) {
            return;
        }
        Counter.builder("mosaic.operations.evicted")
                .register(registry)
                .increment(count);
    }
}
