package com.threadedmosaic.core.model;

import java.nio.file.Path;

/**
 * An already-resolved request to build one mosaic.
 *
 * @param masterImagePath   image to decompose into tiles
 * @param seedDirectoryPath directory of seed images; may be null for {@link MosaicType#COLOR}
 * @param tileSize          edge length of non-edge tiles in pixels
 * @param mosaicType        tile rendering strategy
 * @param outputPath        where the finished mosaic is written; the extension picks the format
 *                          unless {@link MosaicOptions#outputFormat()} is set
 * @param options           per-request overrides, never null
 */
public record MosaicRequest(
    Path masterImagePath,
    Path seedDirectoryPath,
    int tileSize,
    MosaicType mosaicType,
    Path outputPath,
    MosaicOptions options
) {

    public MosaicRequest {
        if (options == null) {
            options = MosaicOptions.DEFAULTS;
        }
    }

    public MosaicRequest(Path masterImagePath, Path seedDirectoryPath, int tileSize,
                         MosaicType mosaicType, Path outputPath) {
        this(masterImagePath, seedDirectoryPath, tileSize, mosaicType, outputPath, MosaicOptions.DEFAULTS);
    }
}
