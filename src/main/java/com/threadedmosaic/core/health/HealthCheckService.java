package com.threadedmosaic.core.health;

import com.threadedmosaic.core.config.MosaicConfig;
import com.threadedmosaic.core.image.ImageOps;
import com.threadedmosaic.core.model.MosaicOperation;
import com.threadedmosaic.core.model.OperationStatus;
import com.threadedmosaic.core.tracker.OperationTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Checks what a mosaic build depends on: image writers for every output format, the operation
 * and tile pools, and the tracker.
 * <p>
 * A pool whose threads are all busy with work waiting behind them is DEGRADED; a missing or shut
 * down pool is DOWN. Missing writers degrade the codecs check until none are left.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ThreadPoolExecutor operationExecutor;
    private final ExecutorService tileExecutor;
    private final OperationTracker tracker;
    private final Clock clock;

    @Autowired
    public HealthCheckService(
            @Autowired(required = false) @Qualifier(MosaicConfig.OPERATION_EXECUTOR) ThreadPoolExecutor operationExecutor,
            @Autowired(required = false) @Qualifier(MosaicConfig.TILE_EXECUTOR) ExecutorService tileExecutor,
            @Autowired(required = false) OperationTracker tracker) {
        this(operationExecutor, tileExecutor, tracker, Clock.systemUTC());
    }

    HealthCheckService(ThreadPoolExecutor operationExecutor, ExecutorService tileExecutor,
                       OperationTracker tracker, Clock clock) {
        this.operationExecutor = operationExecutor;
        this.tileExecutor = tileExecutor;
        this.tracker = tracker;
        this.clock = clock;
    }

    public MosaicHealthReport report() {
        MosaicHealthReport report = MosaicHealthReport.of(List.of(
                checkCodecs(),
                checkPool("operations", "Operation", operationExecutor),
                checkPool("tiles", "Tile", tileExecutor),
                checkTracker()), clock.instant());
        if (report.overall() != ComponentHealth.Level.UP) {
            log.warn("Health is {}: {}", report.overall(), report.components().stream()
                    .filter(c -> c.level() != ComponentHealth.Level.UP)
                    .map(c -> c.component() + "=" + c.level())
                    .toList());
        }
        return report;
    }

    private ComponentHealth checkCodecs() {
        var missing = new TreeSet<String>();
        for (String format : ImageOps.WRITABLE_EXTENSIONS) {
            if (!ImageIO.getImageWritersBySuffix(format).hasNext()) {
                missing.add(format);
            }
        }
        int total = ImageOps.WRITABLE_EXTENSIONS.size();
        Map<String, Integer> gauges = Map.of("writable", total - missing.size());
        if (missing.isEmpty()) {
            return ComponentHealth.up("codecs", "Writers available for all " + total + " output formats", gauges);
        }
        if (missing.size() == total) {
            return ComponentHealth.down("codecs", "No image writers installed");
        }
        return ComponentHealth.degraded("codecs", "Missing writers: " + String.join(", ", missing), gauges);
    }

    private static ComponentHealth checkPool(String component, String label, ExecutorService executor) {
        if (executor == null) {
            return ComponentHealth.down(component, label + " pool not configured");
        }
        if (executor.isShutdown()) {
            return ComponentHealth.down(component, label + " pool is shut down");
        }
        if (!(executor instanceof ThreadPoolExecutor pool)) {
            return ComponentHealth.up(component, label + " pool accepting work", Map.of());
        }
        var gauges = new LinkedHashMap<String, Integer>();
        gauges.put("threads", pool.getMaximumPoolSize());
        gauges.put("active", pool.getActiveCount());
        gauges.put("queued", pool.getQueue().size());
        if (pool.getActiveCount() >= pool.getMaximumPoolSize() && !pool.getQueue().isEmpty()) {
            return ComponentHealth.degraded(component,
                    label + " pool saturated, " + pool.getQueue().size() + " waiting", gauges);
        }
        return ComponentHealth.up(component, label + " pool accepting work", gauges);
    }

    private ComponentHealth checkTracker() {
        if (tracker == null) {
            return ComponentHealth.down("tracker", "Operation tracker not available");
        }
        var counts = new EnumMap<OperationStatus, Integer>(OperationStatus.class);
        for (OperationStatus status : OperationStatus.values()) {
            counts.put(status, 0);
        }
        List<MosaicOperation> operations = tracker.listOperations();
        for (MosaicOperation op : operations) {
            counts.merge(op.status(), 1, Integer::sum);
        }
        var gauges = new LinkedHashMap<String, Integer>();
        counts.forEach((status, count) -> gauges.put(status.name().toLowerCase(Locale.ROOT), count));
        return ComponentHealth.up("tracker", operations.size() + " operations tracked", gauges);
    }
}
