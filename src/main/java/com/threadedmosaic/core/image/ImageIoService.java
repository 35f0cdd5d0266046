package com.threadedmosaic.core.image;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Image decoding and encoding used by the mosaic builder, seed catalog and preview cache.
 * <p>
 * Missing or unreadable files raise {@link com.threadedmosaic.core.exception.ImageResourceException};
 * content that no codec understands raises
 * {@link com.threadedmosaic.core.exception.UnsupportedImageFormatException}.
 */
public interface ImageIoService {

    BufferedImage loadImage(Path path);

    /**
     * Loads an image and downscales it so its longest edge is at most {@code maxDimension}.
     * Images already within bounds are returned at their original size.
     */
    BufferedImage loadScaled(Path path, int maxDimension);

    /**
     * Encodes and writes an image. {@code format} is one of {@code jpg}, {@code png},
     * {@code bmp} or {@code gif}.
     */
    void saveImage(BufferedImage image, Path path, String format);

    /**
     * As {@link #saveImage(BufferedImage, Path, String)} with an explicit JPEG quality in 1..100.
     * Other formats ignore {@code quality}.
     */
    void saveImage(BufferedImage image, Path path, String format, int quality);

    /**
     * Encodes a downscaled copy that fits within {@code maxWidth x maxHeight}, keeping aspect ratio.
     */
    byte[] thumbnail(BufferedImage image, int maxWidth, int maxHeight, String format);
}
