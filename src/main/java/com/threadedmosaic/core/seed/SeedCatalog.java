package com.threadedmosaic.core.seed;

import com.threadedmosaic.core.color.ColorAnalyzer;
import com.threadedmosaic.core.exception.EmptyCatalogException;
import com.threadedmosaic.core.exception.ImageResourceException;
import com.threadedmosaic.core.image.ImageIoService;
import com.threadedmosaic.core.image.ImageOps;
import com.threadedmosaic.core.model.Rgb;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntPredicate;
import java.util.stream.Stream;

/**
 * Seed images available to one operation.
 * <p>
 * Immutable after {@link #load}; safe to read from every tile worker at once. Scaled patches
 * are memoized per seed and tile dimensions, so edge tiles and interior tiles each pay the
 * scaling cost once per seed.
 */
public final class SeedCatalog {

    private static final Logger log = LoggerFactory.getLogger(SeedCatalog.class);

    private final Path directory;
    private final List<SeedImage> seeds;
    private final int skippedCount;
    private final ColorAnalyzer colorAnalyzer;
    private final Random random;
    private final ConcurrentHashMap<PatchKey, BufferedImage> patches = new ConcurrentHashMap<>();

    SeedCatalog(Path directory, List<SeedImage> seeds, int skippedCount,
                ColorAnalyzer colorAnalyzer, Random random) {
        this.directory = directory;
        this.seeds = List.copyOf(seeds);
        this.skippedCount = skippedCount;
        this.colorAnalyzer = colorAnalyzer;
        this.random = random;
    }

    /**
     * Scans {@code directory} (not recursively) in file-name order and decodes every file whose
     * extension is listed. Files that fail to decode are skipped and counted.
     *
     * @throws ImageResourceException when the directory cannot be listed
     * @throws EmptyCatalogException  when nothing decoded
     */
    public static SeedCatalog load(Path directory, ImageIoService imageIo, ColorAnalyzer colorAnalyzer,
                                   Collection<String> extensions, int workingDimension, Random random) {
        List<Path> candidates;
        try (Stream<Path> files = Files.list(directory)) {
            candidates = files
                    .filter(Files::isRegularFile)
                    .filter(p -> extensions.contains(ImageOps.extension(p).toLowerCase(Locale.ROOT)))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ImageResourceException("Cannot list seed directory " + directory, directory, e);
        }

        var seeds = new ArrayList<SeedImage>(candidates.size());
        int skipped = 0;
        for (Path file : candidates) {
            try {
                BufferedImage full = imageIo.loadImage(file);
                Rgb average = colorAnalyzer.averageColor(full);
                BufferedImage working = full.getWidth() > workingDimension || full.getHeight() > workingDimension
                        ? ImageOps.fitWithin(full, workingDimension, workingDimension)
                        : ImageOps.toRgb(full);
                seeds.add(new SeedImage(seeds.size(), file, average, working));
            } catch (ImageResourceException e) {
                skipped++;
                log.warn("Skipping seed {}: {}", file.getFileName(), e.getMessage());
            }
        }

        if (seeds.isEmpty()) {
            throw new EmptyCatalogException(directory);
        }
        log.info("Loaded {} seed images from {} ({} skipped)", seeds.size(), directory, skipped);
        return new SeedCatalog(directory, seeds, skipped, colorAnalyzer, random);
    }

    /**
     * In-memory catalog over already-decoded seeds.
     */
    public static SeedCatalog of(List<SeedImage> seeds, ColorAnalyzer colorAnalyzer, Random random) {
        return new SeedCatalog(null, seeds, 0, colorAnalyzer, random);
    }

    /**
     * The seed whose average color is nearest to {@code target}. Ties go to the earlier seed.
     */
    public SeedImage closestMatch(Rgb target) {
        requireSeeds();
        return closestMatch(target, index -> true);
    }

    /**
     * The nearest seed among those whose index passes {@code eligible}, or null when none does.
     * Ties go to the earlier seed.
     */
    public SeedImage closestMatch(Rgb target, IntPredicate eligible) {
        SeedImage best = null;
        double bestDistance = Double.MAX_VALUE;
        for (SeedImage seed : seeds) {
            if (!eligible.test(seed.index())) {
                continue;
            }
            double d = colorAnalyzer.distance(seed.averageColor(), target);
            if (d < bestDistance) {
                bestDistance = d;
                best = seed;
            }
        }
        return best;
    }

    public SeedImage randomSeed() {
        requireSeeds();
        return seeds.get(random.nextInt(seeds.size()));
    }

    /**
     * The seed scaled to cover {@code width x height} and center-cropped. The returned image is
     * shared between callers and must not be modified.
     */
    public BufferedImage patch(SeedImage seed, int width, int height) {
        return patches.computeIfAbsent(new PatchKey(seed.index(), width, height),
                k -> ImageOps.scaleToCover(seed.image(), width, height));
    }

    public List<SeedImage> seeds() {
        return seeds;
    }

    public int size() {
        return seeds.size();
    }

    public int skippedCount() {
        return skippedCount;
    }

    public boolean isEmpty() {
        return seeds.isEmpty();
    }

    private void requireSeeds() {
        if (seeds.isEmpty()) {
            throw new EmptyCatalogException(directory);
        }
    }

    private record PatchKey(int seedIndex, int width, int height) {}
}
