package com.threadedmosaic.core.tracker;

import com.threadedmosaic.core.config.MosaicProperties;
import com.threadedmosaic.core.image.ImageOps;
import com.threadedmosaic.core.model.MosaicOptions;
import com.threadedmosaic.core.model.MosaicRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Submit-time checks for a {@link MosaicRequest}. Collects every problem rather than stopping at
 * the first. Creates the output's parent directory when it is missing.
 */
@Component
public class MosaicRequestValidator {

    private static final Logger log = LoggerFactory.getLogger(MosaicRequestValidator.class);

    private final MosaicProperties properties;

    public MosaicRequestValidator(MosaicProperties properties) {
        this.properties = properties;
    }

    public List<String> validate(MosaicRequest request) {
        var errors = new ArrayList<String>();
        if (request == null) {
            errors.add("request is required");
            return errors;
        }

        int maxTileSize = properties.getMaxTileSize();
        if (request.tileSize() < 1 || request.tileSize() > maxTileSize) {
            errors.add("tileSize must be between 1 and " + maxTileSize + ", got " + request.tileSize());
        }
        if (request.mosaicType() == null) {
            errors.add("mosaicType is required");
        }
        validateMaster(request.masterImagePath(), errors);
        validateOutput(request.outputPath(), request.options().outputFormat(), errors);
        if (request.mosaicType() != null && request.mosaicType().requiresSeeds()) {
            validateSeedDirectory(request.seedDirectoryPath(), errors);
        }
        validateOptions(request.options(), errors);
        return errors;
    }

    private static void validateOptions(MosaicOptions options, List<String> errors) {
        if (options.quality() != null && (options.quality() < 1 || options.quality() > 100)) {
            errors.add("quality must be between 1 and 100, got " + options.quality());
        }
        if (options.thumbnailMaxWidth() != null && options.thumbnailMaxWidth() < 1) {
            errors.add("thumbnailMaxWidth must be positive, got " + options.thumbnailMaxWidth());
        }
        if (options.thumbnailMaxHeight() != null && options.thumbnailMaxHeight() < 1) {
            errors.add("thumbnailMaxHeight must be positive, got " + options.thumbnailMaxHeight());
        }
        if (options.avoidImageRepetition() && options.maxImageReuse() < 1) {
            errors.add("maxImageReuse must be at least 1 when avoidImageRepetition is set, got "
                    + options.maxImageReuse());
        }
    }

    private void validateMaster(Path master, List<String> errors) {
        if (master == null) {
            errors.add("masterImagePath is required");
        } else if (!Files.isRegularFile(master)) {
            errors.add("master image not found: " + master);
        } else if (!Files.isReadable(master)) {
            errors.add("master image is not readable: " + master);
        }
    }

    private void validateOutput(Path output, String formatOverride, List<String> errors) {
        if (output == null) {
            errors.add("outputPath is required");
            return;
        }
        List<String> writable = ImageOps.WRITABLE_EXTENSIONS.stream().sorted().toList();
        if (formatOverride != null) {
            if (!ImageOps.WRITABLE_EXTENSIONS.contains(formatOverride.trim().toLowerCase(Locale.ROOT))) {
                errors.add("outputFormat must be one of " + writable + ", got " + formatOverride);
                return;
            }
        } else if (!ImageOps.WRITABLE_EXTENSIONS.contains(ImageOps.extension(output))) {
            errors.add("outputPath must end in one of " + writable + ": " + output);
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            try {
                Files.createDirectories(parent);
                log.debug("Created output directory {}", parent);
            } catch (IOException e) {
                errors.add("cannot create output directory " + parent + ": " + e.getMessage());
            }
        }
    }

    private void validateSeedDirectory(Path seeds, List<String> errors) {
        if (seeds == null) {
            errors.add("seedDirectoryPath is required for this mosaic type");
            return;
        }
        if (!Files.isDirectory(seeds)) {
            errors.add("seed directory not found: " + seeds);
            return;
        }
        if (!Files.isReadable(seeds)) {
            errors.add("seed directory is not readable: " + seeds);
            return;
        }
        try (Stream<Path> files = Files.list(seeds)) {
            boolean anyImage = files
                    .filter(Files::isRegularFile)
                    .anyMatch(p -> properties.isSupportedImage(p.getFileName().toString()));
            if (!anyImage) {
                errors.add("seed directory contains no supported images: " + seeds);
            }
        } catch (IOException e) {
            errors.add("cannot list seed directory " + seeds + ": " + e.getMessage());
        }
    }
}
