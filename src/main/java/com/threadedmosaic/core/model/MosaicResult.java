package com.threadedmosaic.core.model;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of one {@code MosaicBuilder} run.
 *
 * @param outcome       whether the build finished or stopped on a cancellation request
 * @param outputPath    written file; null when cancelled
 * @param tileCount     tiles in the grid
 * @param tilesRendered tiles actually painted
 * @param elapsed       wall-clock build time
 */
public record MosaicResult(
    Outcome outcome,
    Path outputPath,
    int tileCount,
    int tilesRendered,
    Duration elapsed
) {

    public enum Outcome { COMPLETED, CANCELLED }

    public static MosaicResult completed(Path outputPath, int tileCount, Duration elapsed) {
        return new MosaicResult(Outcome.COMPLETED, outputPath, tileCount, tileCount, elapsed);
    }

    public static MosaicResult cancelled(int tileCount, int tilesRendered, Duration elapsed) {
        return new MosaicResult(Outcome.CANCELLED, null, tileCount, tilesRendered, elapsed);
    }

    public boolean isCancelled() {
        return outcome == Outcome.CANCELLED;
    }
}
