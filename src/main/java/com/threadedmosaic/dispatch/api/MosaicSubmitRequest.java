package com.threadedmosaic.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/mosaics.
 *
 * @param masterImagePath      path of the image to reproduce
 * @param seedDirectoryPath    directory of seed images; required for HUE and PHOTO
 * @param tileSize             tile edge in pixels
 * @param mosaicType           COLOR, HUE or PHOTO (case-insensitive)
 * @param outputPath           where to write the mosaic; the extension selects the format
 * @param quality              optional JPEG quality 1..100
 * @param outputFormat         optional format overriding the output extension
 * @param thumbnailMaxWidth    optional preview width bound
 * @param thumbnailMaxHeight   optional preview height bound
 * @param avoidImageRepetition PHOTO only: cap how many tiles one seed may fill
 * @param maxImageReuse        tiles allowed per seed when the cap is on
 */
public record MosaicSubmitRequest(
    @JsonProperty("master_image_path") String masterImagePath,
    @JsonProperty("seed_directory_path") String seedDirectoryPath,
    @JsonProperty("tile_size") Integer tileSize,
    @JsonProperty("mosaic_type") String mosaicType,
    @JsonProperty("output_path") String outputPath,
    @JsonProperty("quality") Integer quality,
    @JsonProperty("output_format") String outputFormat,
    @JsonProperty("thumbnail_max_width") Integer thumbnailMaxWidth,
    @JsonProperty("thumbnail_max_height") Integer thumbnailMaxHeight,
    @JsonProperty("avoid_image_repetition") Boolean avoidImageRepetition,
    @JsonProperty("max_image_reuse") Integer maxImageReuse
) {}
