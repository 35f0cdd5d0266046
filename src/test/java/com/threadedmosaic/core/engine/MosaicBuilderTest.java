package com.threadedmosaic.core.engine;

import com.threadedmosaic.core.color.ColorAnalyzer;
import com.threadedmosaic.core.exception.EmptyCatalogException;
import com.threadedmosaic.core.exception.ImageResourceException;
import com.threadedmosaic.core.exception.TileRenderException;
import com.threadedmosaic.core.grid.TileGridCalculator;
import com.threadedmosaic.core.image.DefaultImageIoService;
import com.threadedmosaic.core.metrics.MosaicMetrics;
import com.threadedmosaic.core.model.MosaicOptions;
import com.threadedmosaic.core.model.MosaicRequest;
import com.threadedmosaic.core.model.MosaicResult;
import com.threadedmosaic.core.model.MosaicType;
import com.threadedmosaic.core.model.Rgb;
import com.threadedmosaic.core.model.Tile;
import com.threadedmosaic.support.TestImages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MosaicBuilderTest {

    private static final List<String> EXTENSIONS = List.of("jpg", "jpeg", "png", "bmp", "gif", "tif", "tiff");

    @TempDir
    Path dir;

    private ExecutorService tileExecutor;
    private SimpleMeterRegistry registry;
    private DefaultImageIoService imageIo;

    @BeforeEach
    void setUp() {
        tileExecutor = Executors.newFixedThreadPool(4);
        registry = new SimpleMeterRegistry();
        imageIo = new DefaultImageIoService(85);
    }

    @AfterEach
    void tearDown() {
        tileExecutor.shutdownNow();
    }

    private MosaicBuilder builder(ColorAnalyzer analyzer, Executor executor, int parallelism) {
        return new MosaicBuilder(imageIo, new TileGridCalculator(), analyzer, EXTENSIONS, 64,
                executor, parallelism, new MosaicMetrics(registry), () -> new Random(11));
    }

    private MosaicBuilder builder(ColorAnalyzer analyzer) {
        return builder(analyzer, tileExecutor, 4);
    }

    private MosaicBuilder builder() {
        return builder(new ColorAnalyzer());
    }

    private Path master(BufferedImage image) {
        return TestImages.write(image, dir.resolve("master.png"));
    }

    private Path seedDir(Rgb... colors) throws Exception {
        Path seeds = Files.createDirectories(dir.resolve("seeds"));
        for (int i = 0; i < colors.length; i++) {
            TestImages.write(TestImages.solid(16, 16, colors[i]), seeds.resolve("seed-" + i + ".png"));
        }
        return seeds;
    }

    private List<Path> leftoverTempFiles() throws Exception {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".tmp")).toList();
        }
    }

    /** Records every report so ordering can be checked afterwards. */
    private static class RecordingSink implements ProgressSink {
        final List<Integer> percents = new CopyOnWriteArrayList<>();
        final List<String> steps = new CopyOnWriteArrayList<>();

        @Override
        public void report(String operationId, int percent, String step) {
            percents.add(percent);
            steps.add(step);
        }
    }

    // -- Successful builds -------------------------------------------------------

    @Nested
    @DisplayName("completed builds")
    class CompletedTests {

        @Test
        @DisplayName("COLOR mosaic of a solid master reproduces it tile for tile")
        void colorMosaic() {
            Path out = dir.resolve("out.png");
            var request = new MosaicRequest(master(TestImages.solid(50, 50, new Rgb(255, 0, 0))),
                    null, 10, MosaicType.COLOR, out);

            MosaicResult result = builder().build(request, BuildContext.of("op-1"));

            assertFalse(result.isCancelled());
            assertEquals(25, result.tileCount());
            assertEquals(out, result.outputPath());
            BufferedImage written = imageIo.loadImage(out);
            assertEquals(50, written.getWidth());
            assertEquals(new Rgb(255, 0, 0), new ColorAnalyzer().averageColor(written));
        }

        @Test
        @DisplayName("PHOTO mosaic picks the nearest seed per tile")
        void photoMosaic() throws Exception {
            Path out = dir.resolve("photo.png");
            var request = new MosaicRequest(master(TestImages.split(20, 10, Rgb.BLACK, Rgb.WHITE)),
                    seedDir(Rgb.WHITE, Rgb.BLACK), 10, MosaicType.PHOTO, out);

            builder().build(request, BuildContext.of("op-2"));

            BufferedImage written = imageIo.loadImage(out);
            assertEquals(Rgb.BLACK, TestImages.pixel(written, 2, 5));
            assertEquals(Rgb.WHITE, TestImages.pixel(written, 17, 5));
        }

        @Test
        @DisplayName("HUE mosaic tints seeds toward each tile color")
        void hueMosaic() throws Exception {
            Path out = dir.resolve("hue.png");
            var request = new MosaicRequest(master(TestImages.solid(20, 20, Rgb.BLACK)),
                    seedDir(Rgb.WHITE), 10, MosaicType.HUE, out);

            builder().build(request, BuildContext.of("op-3"));

            assertEquals(new Rgb(45, 45, 45), TestImages.pixel(imageIo.loadImage(out), 12, 12));
        }

        @Test
        @DisplayName("progress is non-decreasing and ends at 100 with a saving step")
        void progressMonotonic() {
            var sink = new RecordingSink();
            var request = new MosaicRequest(master(TestImages.solid(100, 100, Rgb.WHITE)),
                    null, 5, MosaicType.COLOR, dir.resolve("p.png"));

            builder().build(request, new BuildContext("op-4", sink, null, null));

            for (int i = 1; i < sink.percents.size(); i++) {
                assertTrue(sink.percents.get(i) >= sink.percents.get(i - 1),
                        "progress went backwards at report " + i + ": " + sink.percents);
            }
            assertEquals("loading master image", sink.steps.get(0));
            assertEquals(100, sink.percents.get(sink.percents.size() - 1));
            assertEquals("saving", sink.steps.get(sink.steps.size() - 1));
        }

        @Test
        @DisplayName("listener sees the tile count and the live canvas")
        void listener() {
            var tileCount = new AtomicInteger();
            var canvas = new AtomicReference<BufferedImage>();
            var listener = new BuildListener() {
                @Override
                public void gridCalculated(int count) {
                    tileCount.set(count);
                }

                @Override
                public void canvasCreated(BufferedImage image) {
                    canvas.set(image);
                }
            };
            var request = new MosaicRequest(master(TestImages.solid(30, 20, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, dir.resolve("l.png"));

            builder().build(request, new BuildContext("op-5", null, null, listener));

            assertEquals(6, tileCount.get());
            assertNotNull(canvas.get());
            assertEquals(Rgb.WHITE, TestImages.pixel(canvas.get(), 29, 19));
        }

        @Test
        @DisplayName("JPEG output, missing parent directories and no temp files left")
        void jpegOutput() throws Exception {
            Path out = dir.resolve("nested/deeper/out.jpg");
            var request = new MosaicRequest(master(TestImages.solid(20, 20, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, out);

            builder().build(request, BuildContext.of("op-6"));

            assertTrue(Files.exists(out));
            assertTrue(leftoverTempFiles().isEmpty());
            try (Stream<Path> files = Files.list(out.getParent())) {
                assertEquals(1, files.count());
            }
        }

        @Test
        @DisplayName("tiles rendered are counted in metrics")
        void metrics() {
            var request = new MosaicRequest(master(TestImages.solid(20, 20, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, dir.resolve("m.png"));

            builder().build(request, BuildContext.of("op-7"));

            assertEquals(4.0, registry.find("mosaic.tiles.rendered").tag("type", "COLOR").counter().count());
        }
    }

    // -- Request options -------------------------------------------------------------

    @Nested
    @DisplayName("request options")
    class OptionTests {

        @Test
        @DisplayName("output format override wins over the file extension")
        void formatOverride() throws Exception {
            Path out = dir.resolve("mosaic.out");
            var options = new MosaicOptions(null, "png", null, null, false, 0);
            var request = new MosaicRequest(master(TestImages.solid(20, 20, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, out, options);

            builder().build(request, BuildContext.of("op-fmt"));

            byte[] header = Files.readAllBytes(out);
            assertEquals((byte) 0x89, header[0]);
            assertEquals('P', header[1]);
            assertEquals('N', header[2]);
            assertEquals('G', header[3]);
        }

        @Test
        @DisplayName("per-request JPEG quality changes the encoded size")
        void qualityOverride() throws Exception {
            Path master = master(TestImages.split(120, 120, new Rgb(200, 30, 90), new Rgb(20, 160, 240)));
            Path low = dir.resolve("low.jpg");
            Path high = dir.resolve("high.jpg");

            builder().build(new MosaicRequest(master, null, 7, MosaicType.COLOR, low,
                    new MosaicOptions(5, null, null, null, false, 0)), BuildContext.of("op-q1"));
            builder().build(new MosaicRequest(master, null, 7, MosaicType.COLOR, high,
                    new MosaicOptions(100, null, null, null, false, 0)), BuildContext.of("op-q2"));

            assertTrue(Files.size(low) < Files.size(high), Files.size(low) + " vs " + Files.size(high));
        }

        @Test
        @DisplayName("PHOTO reuse cap spreads tiles over the next nearest seeds")
        void reuseCap() throws Exception {
            Path seeds = seedDir(Rgb.WHITE, new Rgb(200, 200, 200));
            Path master = master(TestImages.solid(40, 10, Rgb.WHITE));
            Path capped = dir.resolve("capped.png");
            Path free = dir.resolve("free.png");

            builder().build(new MosaicRequest(master, seeds, 10, MosaicType.PHOTO, capped,
                    new MosaicOptions(null, null, null, null, true, 2)), BuildContext.of("op-cap"));
            builder().build(new MosaicRequest(master, seeds, 10, MosaicType.PHOTO, free),
                    BuildContext.of("op-free"));

            BufferedImage cappedImage = imageIo.loadImage(capped);
            long whiteTiles = Stream.of(5, 15, 25, 35)
                    .filter(x -> TestImages.pixel(cappedImage, x, 5).equals(Rgb.WHITE))
                    .count();
            assertEquals(2, whiteTiles);
            BufferedImage freeImage = imageIo.loadImage(free);
            assertTrue(Stream.of(5, 15, 25, 35).allMatch(x -> TestImages.pixel(freeImage, x, 5).equals(Rgb.WHITE)));
        }
    }

    // -- Worker fan-out --------------------------------------------------------------

    @Nested
    @DisplayName("tile workers")
    class WorkerTests {

        @Test
        @DisplayName("a build submits at most tileParallelism tasks however many tiles it has")
        void boundedFanOut() {
            var submitted = new AtomicInteger();
            Executor counting = task -> {
                submitted.incrementAndGet();
                tileExecutor.execute(task);
            };
            var request = new MosaicRequest(master(TestImages.solid(100, 100, Rgb.WHITE)),
                    null, 5, MosaicType.COLOR, dir.resolve("w.png"));

            MosaicResult result = builder(new ColorAnalyzer(), counting, 3).build(request, BuildContext.of("op-w"));

            assertEquals(400, result.tileCount());
            assertEquals(3, submitted.get());
        }

        @Test
        @DisplayName("fewer tiles than workers submits one task per tile")
        void fewTiles() {
            var submitted = new AtomicInteger();
            Executor counting = task -> {
                submitted.incrementAndGet();
                tileExecutor.execute(task);
            };
            var request = new MosaicRequest(master(TestImages.solid(20, 10, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, dir.resolve("few.png"));

            builder(new ColorAnalyzer(), counting, 8).build(request, BuildContext.of("op-few"));

            assertEquals(2, submitted.get());
        }

        @Test
        @DisplayName("a slow progress sink does not hold up the other workers")
        void slowSinkDoesNotStallWorkers() {
            var analyzed = new CountDownLatch(16);
            var analyzer = new ColorAnalyzer() {
                @Override
                public Rgb averageColor(BufferedImage image, Tile tile) {
                    analyzed.countDown();
                    return super.averageColor(image, tile);
                }
            };
            var allAnalyzedWhileBlocked = new AtomicBoolean();
            var blockedOnce = new AtomicBoolean();
            var sink = new RecordingSink() {
                @Override
                public void report(String operationId, int percent, String step) {
                    if (step.startsWith("analyzing") && blockedOnce.compareAndSet(false, true)) {
                        try {
                            allAnalyzedWhileBlocked.set(analyzed.await(10, TimeUnit.SECONDS));
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    super.report(operationId, percent, step);
                }
            };
            var request = new MosaicRequest(master(TestImages.solid(40, 40, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, dir.resolve("slow.png"));

            MosaicResult result = builder(analyzer).build(request, new BuildContext("op-slow", sink, null, null));

            assertFalse(result.isCancelled());
            assertTrue(allAnalyzedWhileBlocked.get(), "workers waited on the sink");
            for (int i = 1; i < sink.percents.size(); i++) {
                assertTrue(sink.percents.get(i) >= sink.percents.get(i - 1), "went backwards: " + sink.percents);
            }
            assertEquals("saving", sink.steps.get(sink.steps.size() - 1));
        }
    }

    // -- Cancellation --------------------------------------------------------------

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("cancel after 30% stops starting tiles and writes nothing")
        void cancelMidway() throws Exception {
            var cancelled = new AtomicBoolean();
            ProgressSink sink = (id, percent, step) -> {
                if (percent >= 30) {
                    cancelled.set(true);
                }
            };
            Path out = dir.resolve("cancelled.png");
            var request = new MosaicRequest(master(TestImages.solid(100, 100, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, out);

            MosaicResult result = builder().build(request, new BuildContext("op-c", sink, cancelled::get, null));

            assertTrue(result.isCancelled());
            assertTrue(result.tilesRendered() >= 30 && result.tilesRendered() < 100,
                    "rendered " + result.tilesRendered());
            assertNull(result.outputPath());
            assertFalse(Files.exists(out));
            assertTrue(leftoverTempFiles().isEmpty());
        }

        @Test
        @DisplayName("cancel requested while saving leaves no output or temp file")
        void cancelDuringSave() throws Exception {
            var cancelled = new AtomicBoolean();
            ProgressSink sink = (id, percent, step) -> {
                if ("saving".equals(step)) {
                    cancelled.set(true);
                }
            };
            Path out = dir.resolve("late.png");
            var request = new MosaicRequest(master(TestImages.solid(20, 20, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, out);

            MosaicResult result = builder().build(request, new BuildContext("op-s", sink, cancelled::get, null));

            assertTrue(result.isCancelled());
            assertEquals(4, result.tilesRendered());
            assertFalse(Files.exists(out));
            assertTrue(leftoverTempFiles().isEmpty());
        }

        @Test
        @DisplayName("a token already set renders no tiles")
        void cancelledUpFront() {
            var request = new MosaicRequest(master(TestImages.solid(20, 20, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, dir.resolve("none.png"));

            MosaicResult result = builder().build(request, new BuildContext("op-u", null, () -> true, null));

            assertTrue(result.isCancelled());
            assertEquals(0, result.tilesRendered());
        }
    }

    // -- Failures -------------------------------------------------------------------

    @Nested
    @DisplayName("failures")
    class FailureTests {

        @Test
        @DisplayName("a failing tile aborts the build with its index")
        void tileFailure() throws Exception {
            var analyzer = new ColorAnalyzer() {
                @Override
                public Rgb averageColor(BufferedImage image, Tile tile) {
                    if (tile.index() == 3) {
                        throw new IllegalStateException("boom");
                    }
                    return super.averageColor(image, tile);
                }
            };
            Path out = dir.resolve("fail.png");
            var request = new MosaicRequest(master(TestImages.solid(40, 40, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, out);

            var ex = assertThrows(TileRenderException.class,
                    () -> builder(analyzer).build(request, BuildContext.of("op-f")));

            assertEquals(3, ex.getTileIndex());
            assertTrue(ex.getMessage().contains("boom"));
            assertFalse(Files.exists(out));
            assertTrue(leftoverTempFiles().isEmpty());
        }

        @Test
        @DisplayName("an Error thrown by a tile still aborts the build as a tile failure")
        void tileError() throws Exception {
            var analyzer = new ColorAnalyzer() {
                @Override
                public Rgb averageColor(BufferedImage image, Tile tile) {
                    if (tile.index() == 2) {
                        throw new OutOfMemoryError("tile buffer");
                    }
                    return super.averageColor(image, tile);
                }
            };
            Path out = dir.resolve("oom.png");
            var request = new MosaicRequest(master(TestImages.solid(40, 40, Rgb.WHITE)),
                    null, 10, MosaicType.COLOR, out);

            var ex = assertThrows(TileRenderException.class,
                    () -> builder(analyzer).build(request, BuildContext.of("op-oom")));

            assertEquals(2, ex.getTileIndex());
            assertInstanceOf(OutOfMemoryError.class, ex.getCause());
            assertFalse(Files.exists(out));
        }

        @Test
        @DisplayName("seed directory with no decodable image fails with EmptyCatalogException")
        void emptyCatalog() throws Exception {
            Path seeds = Files.createDirectories(dir.resolve("seeds"));
            Files.writeString(seeds.resolve("broken.png"), "garbage");
            var request = new MosaicRequest(master(TestImages.solid(20, 20, Rgb.WHITE)),
                    seeds, 10, MosaicType.PHOTO, dir.resolve("e.png"));

            var ex = assertThrows(EmptyCatalogException.class,
                    () -> builder().build(request, BuildContext.of("op-e")));
            assertTrue(ex.getMessage().contains("No usable seed images"));
        }

        @Test
        @DisplayName("missing master raises ImageResourceException")
        void missingMaster() {
            var request = new MosaicRequest(dir.resolve("missing.png"), null, 10, MosaicType.COLOR,
                    dir.resolve("x.png"));
            assertThrows(ImageResourceException.class, () -> builder().build(request, BuildContext.of("op-m")));
        }
    }
}
