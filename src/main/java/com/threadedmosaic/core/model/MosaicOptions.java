package com.threadedmosaic.core.model;

/**
 * Per-request overrides on top of the configured output and preview defaults.
 *
 * @param quality              JPEG quality 1..100; null for the configured default
 * @param outputFormat         jpg, png, bmp or gif; null to take the format from the output extension
 * @param thumbnailMaxWidth    preview width bound in pixels; null for the configured default
 * @param thumbnailMaxHeight   preview height bound in pixels; null for the configured default
 * @param avoidImageRepetition PHOTO only: cap how many tiles may use the same seed
 * @param maxImageReuse        tiles allowed per seed while {@code avoidImageRepetition} is set
 */
public record MosaicOptions(
    Integer quality,
    String outputFormat,
    Integer thumbnailMaxWidth,
    Integer thumbnailMaxHeight,
    boolean avoidImageRepetition,
    int maxImageReuse
) {

    public static final MosaicOptions DEFAULTS = new MosaicOptions(null, null, null, null, false, 0);

    public int qualityOr(int configured) {
        return quality != null ? quality : configured;
    }

    public int thumbnailMaxWidthOr(int configured) {
        return thumbnailMaxWidth != null ? thumbnailMaxWidth : configured;
    }

    public int thumbnailMaxHeightOr(int configured) {
        return thumbnailMaxHeight != null ? thumbnailMaxHeight : configured;
    }

    public boolean limitsSeedReuse() {
        return avoidImageRepetition && maxImageReuse > 0;
    }
}
