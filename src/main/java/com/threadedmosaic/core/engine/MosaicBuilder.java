package com.threadedmosaic.core.engine;

import com.threadedmosaic.core.color.ColorAnalyzer;
import com.threadedmosaic.core.config.MosaicConfig;
import com.threadedmosaic.core.config.MosaicProperties;
import com.threadedmosaic.core.exception.ImageResourceException;
import com.threadedmosaic.core.exception.TileRenderException;
import com.threadedmosaic.core.grid.TileGridCalculator;
import com.threadedmosaic.core.image.ImageIoService;
import com.threadedmosaic.core.image.ImageOps;
import com.threadedmosaic.core.logging.MdcContext;
import com.threadedmosaic.core.metrics.MosaicMetrics;
import com.threadedmosaic.core.model.MosaicOptions;
import com.threadedmosaic.core.model.MosaicRequest;
import com.threadedmosaic.core.model.MosaicResult;
import com.threadedmosaic.core.model.Rgb;
import com.threadedmosaic.core.model.Tile;
import com.threadedmosaic.core.seed.SeedCatalog;
import com.threadedmosaic.core.strategy.MosaicStrategies;
import com.threadedmosaic.core.strategy.MosaicStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Builds one mosaic from a master image.
 * <p>
 * Tiles are rendered on the shared tile executor by at most {@code tileParallelism} workers per
 * build, each claiming the next unrendered tile and painting it into its own disjoint rectangle
 * of a single output canvas. Cancellation is polled before every tile and around
 * the final write; tiles already running are allowed to finish. The output is written to a
 * temporary sibling file and moved into place, so a cancelled or failed build never leaves a
 * partial file at the requested path.
 */
@Service
public class MosaicBuilder {

    private static final Logger log = LoggerFactory.getLogger(MosaicBuilder.class);

    private final ImageIoService imageIo;
    private final TileGridCalculator gridCalculator;
    private final ColorAnalyzer colorAnalyzer;
    private final Collection<String> seedExtensions;
    private final int seedWorkingDimension;
    private final Executor tileExecutor;
    private final int tileParallelism;
    private final MosaicMetrics metrics;
    private final Supplier<Random> randomFactory;

    @Autowired
    public MosaicBuilder(ImageIoService imageIo, TileGridCalculator gridCalculator, ColorAnalyzer colorAnalyzer,
                         MosaicProperties properties,
                         @Qualifier(MosaicConfig.TILE_EXECUTOR) Executor tileExecutor,
                         @Autowired(required = false) MosaicMetrics metrics) {
        this(imageIo, gridCalculator, colorAnalyzer, properties.getSupportedExtensions(),
                properties.getSeedWorkingDimension(), tileExecutor, properties.getTileParallelism(),
                metrics, Random::new);
    }

    MosaicBuilder(ImageIoService imageIo, TileGridCalculator gridCalculator, ColorAnalyzer colorAnalyzer,
                  Collection<String> seedExtensions, int seedWorkingDimension, Executor tileExecutor,
                  int tileParallelism, MosaicMetrics metrics, Supplier<Random> randomFactory) {
        this.imageIo = imageIo;
        this.gridCalculator = gridCalculator;
        this.colorAnalyzer = colorAnalyzer;
        this.seedExtensions = List.copyOf(seedExtensions);
        this.seedWorkingDimension = seedWorkingDimension;
        this.tileExecutor = tileExecutor;
        this.tileParallelism = Math.max(1, tileParallelism);
        this.metrics = metrics;
        this.randomFactory = randomFactory;
    }

    /**
     * Runs the build to completion, cancellation or failure.
     *
     * @return COMPLETED with the written path, or CANCELLED with no file written
     * @throws ImageResourceException for unreadable inputs, an empty seed catalog or a failed write
     * @throws TileRenderException    when any tile fails, errors included; remaining tiles are skipped
     */
    public MosaicResult build(MosaicRequest request, BuildContext ctx) {
        long start = System.nanoTime();
        String operationId = ctx.operationId();
        var progress = new SerializedProgress(operationId, ctx.progressSink());

        progress.report(0, "loading master image");
        BufferedImage master = imageIo.loadImage(request.masterImagePath());
        List<Tile> tiles = gridCalculator.calculate(master.getWidth(), master.getHeight(), request.tileSize());
        ctx.listener().gridCalculated(tiles.size());
        log.info("Master {}x{} split into {} tiles of {}px",
                master.getWidth(), master.getHeight(), tiles.size(), request.tileSize());

        MosaicStrategy strategy = MosaicStrategies.forRequest(request);
        SeedCatalog catalog = null;
        if (strategy.requiresSeeds()) {
            progress.report(0, "loading seeds");
            catalog = SeedCatalog.load(request.seedDirectoryPath(), imageIo, colorAnalyzer,
                    seedExtensions, seedWorkingDimension, randomFactory.get());
            if (metrics != null) {
                metrics.recordSeedCatalog(catalog.size(), catalog.skippedCount());
            }
        }

        var canvas = new BufferedImage(master.getWidth(), master.getHeight(), BufferedImage.TYPE_INT_RGB);
        ctx.listener().canvasCreated(canvas);

        int rendered = renderTiles(tiles, master, canvas, strategy, catalog, ctx, progress);
        if (metrics != null && rendered > 0) {
            metrics.recordTilesRendered(request.mosaicType(), rendered);
        }
        if (rendered < tiles.size() || ctx.cancellation().isCancellationRequested()) {
            log.info("Build cancelled after {}/{} tiles", rendered, tiles.size());
            return MosaicResult.cancelled(tiles.size(), rendered, elapsedSince(start));
        }

        progress.report(100, "saving");
        Path written = save(canvas, request, ctx.cancellation());
        if (written == null) {
            log.info("Build cancelled before the output was moved into place");
            return MosaicResult.cancelled(tiles.size(), rendered, elapsedSince(start));
        }

        Duration elapsed = elapsedSince(start);
        log.info("Mosaic written to {} in {} ms", written, elapsed.toMillis());
        return MosaicResult.completed(written, tiles.size(), elapsed);
    }

    private int renderTiles(List<Tile> tiles, BufferedImage master, BufferedImage canvas,
                            MosaicStrategy strategy, SeedCatalog catalog,
                            BuildContext ctx, SerializedProgress progress) {
        String operationId = ctx.operationId();
        int total = tiles.size();
        var next = new AtomicInteger();
        var done = new AtomicInteger();
        var stopped = new AtomicBoolean();
        var failure = new AtomicReference<TileRenderException>();

        int workers = Math.min(tileParallelism, total);
        var futures = new ArrayList<CompletableFuture<Void>>(workers);
        for (int w = 0; w < workers; w++) {
            futures.add(CompletableFuture.runAsync(() -> {
                int i;
                while ((i = next.getAndIncrement()) < total) {
                    if (failure.get() != null || stopped.get()) {
                        return;
                    }
                    if (ctx.cancellation().isCancellationRequested()) {
                        stopped.set(true);
                        return;
                    }
                    Tile tile = tiles.get(i);
                    MdcContext.setTile(operationId, tile.index());
                    try {
                        Rgb color = colorAnalyzer.averageColor(master, tile);
                        BufferedImage cell = strategy.render(tile, color, catalog);
                        int[] pixels = cell.getRGB(0, 0, tile.width(), tile.height(), null, 0, tile.width());
                        canvas.setRGB(tile.x(), tile.y(), tile.width(), tile.height(), pixels, 0, tile.width());

                        int completed = done.incrementAndGet();
                        progress.report((int) Math.round(100.0 * completed / total),
                                "analyzing tile " + completed + " of " + total);
                    } catch (Throwable e) {
                        log.error("Tile {} failed: {}", tile.index(), e.getMessage(), e);
                        failure.compareAndSet(null, new TileRenderException(tile.index(), e));
                        return;
                    } finally {
                        MdcContext.clear();
                    }
                }
            }, tileExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        if (failure.get() != null) {
            throw failure.get();
        }
        return done.get();
    }

    /**
     * Writes to a temporary sibling, then moves it onto the requested output path.
     *
     * @return the output path, or null when cancellation was requested before the move
     */
    private Path save(BufferedImage canvas, MosaicRequest request, CancellationToken cancellation) {
        if (cancellation.isCancellationRequested()) {
            return null;
        }
        Path target = request.outputPath();
        MosaicOptions options = request.options();
        String format = ImageOps.outputFormat(target, options.outputFormat());
        Path parent = target.toAbsolutePath().getParent();
        Path temp;
        try {
            Files.createDirectories(parent);
            temp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
        } catch (IOException e) {
            throw new ImageResourceException("Cannot prepare output location " + target, target, e);
        }

        boolean moved = false;
        try {
            if (options.quality() != null) {
                imageIo.saveImage(canvas, temp, format, options.quality());
            } else {
                imageIo.saveImage(canvas, temp, format);
            }
            if (cancellation.isCancellationRequested()) {
                return null;
            }
            moveIntoPlace(temp, target);
            moved = true;
            return target;
        } finally {
            if (!moved) {
                deleteQuietly(temp);
            }
        }
    }

    private static void moveIntoPlace(Path temp, Path target) {
        try {
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ImageResourceException("Failed to move output into " + target, target, e);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Orders reports from tile workers and clamps them so the sink never sees a smaller
     * percentage than one it already received.
     * <p>
     * Reports are queued under the lock and handed to the sink outside it by whichever thread
     * finds no delivery in progress. A slow sink delays delivery but never blocks a worker that
     * only enqueues.
     */
    private static final class SerializedProgress {

        private final String operationId;
        private final ProgressSink sink;
        private final ArrayDeque<Report> pending = new ArrayDeque<>();
        private int lastPercent = -1;
        private boolean delivering;

        SerializedProgress(String operationId, ProgressSink sink) {
            this.operationId = operationId;
            this.sink = sink;
        }

        void report(int percent, String step) {
            synchronized (this) {
                int clamped = Math.max(lastPercent, Math.min(100, percent));
                if (clamped == lastPercent && step.startsWith("analyzing")) {
                    return;
                }
                lastPercent = clamped;
                pending.add(new Report(clamped, step));
                if (delivering) {
                    return;
                }
                delivering = true;
            }
            deliver();
        }

        private void deliver() {
            while (true) {
                Report next;
                synchronized (this) {
                    next = pending.poll();
                    if (next == null) {
                        delivering = false;
                        return;
                    }
                }
                try {
                    sink.report(operationId, next.percent(), next.step());
                } catch (RuntimeException | Error e) {
                    synchronized (this) {
                        delivering = false;
                    }
                    throw e;
                }
            }
        }

        private record Report(int percent, String step) {}
    }
}
