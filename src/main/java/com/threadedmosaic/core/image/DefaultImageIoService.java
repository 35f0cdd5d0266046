package com.threadedmosaic.core.image;

import com.threadedmosaic.core.config.MosaicProperties;
import com.threadedmosaic.core.exception.ImageResourceException;
import com.threadedmosaic.core.exception.UnsupportedImageFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * {@link ImageIoService} backed by {@code javax.imageio}.
 * <p>
 * A decode that fails with an {@link IOException} is retried once before giving up;
 * a file that decodes to nothing is reported as an unsupported format without retry.
 */
@Service
public class DefaultImageIoService implements ImageIoService {

    private static final Logger log = LoggerFactory.getLogger(DefaultImageIoService.class);

    private final int jpegQuality;

    public DefaultImageIoService(MosaicProperties properties) {
        this(properties.getJpegQuality());
    }

    public DefaultImageIoService(int jpegQuality) {
        this.jpegQuality = checkQuality(jpegQuality);
    }

    @Override
    public BufferedImage loadImage(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ImageResourceException("Image file not found: " + path, path);
        }
        IOException lastError = null;
        for (int attempt = 1; attempt <= 2; attempt++) {
            try (InputStream in = Files.newInputStream(path)) {
                BufferedImage image = ImageIO.read(in);
                if (image == null) {
                    throw new UnsupportedImageFormatException(
                            "No decoder recognised " + path.getFileName(), path, ImageOps.extension(path));
                }
                return image;
            } catch (NoSuchFileException e) {
                throw new ImageResourceException("Image file not found: " + path, path, e);
            } catch (IOException e) {
                lastError = e;
                log.debug("Decode attempt {} failed for {}: {}", attempt, path, e.getMessage());
            }
        }
        throw new UnsupportedImageFormatException(
                "Could not decode " + path.getFileName() + ": " + lastError.getMessage(),
                path, ImageOps.extension(path));
    }

    @Override
    public BufferedImage loadScaled(Path path, int maxDimension) {
        BufferedImage image = loadImage(path);
        if (image.getWidth() <= maxDimension && image.getHeight() <= maxDimension) {
            return image;
        }
        return ImageOps.fitWithin(image, maxDimension, maxDimension);
    }

    @Override
    public void saveImage(BufferedImage image, Path path, String format) {
        saveImage(image, path, format, jpegQuality);
    }

    @Override
    public void saveImage(BufferedImage image, Path path, String format, int quality) {
        checkQuality(quality);
        try (OutputStream out = Files.newOutputStream(path)) {
            write(image, format, quality, out);
        } catch (IOException e) {
            throw new ImageResourceException("Failed to write " + path + ": " + e.getMessage(), path, e);
        }
    }

    @Override
    public byte[] thumbnail(BufferedImage image, int maxWidth, int maxHeight, String format) {
        BufferedImage scaled = ImageOps.fitWithin(image, maxWidth, maxHeight);
        try (var out = new ByteArrayOutputStream()) {
            write(scaled, format, jpegQuality, out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new ImageResourceException("Thumbnail encoding failed: " + e.getMessage(), null, e);
        }
    }

    private static int checkQuality(int quality) {
        if (quality < 1 || quality > 100) {
            throw new IllegalArgumentException("JPEG quality must be in 1..100: " + quality);
        }
        return quality;
    }

    private static void write(BufferedImage image, String format, int quality, OutputStream out) throws IOException {
        String normalized = "jpeg".equals(format) ? "jpg" : format;
        BufferedImage opaque = "png".equals(normalized) || "gif".equals(normalized)
                ? image : ImageOps.toRgb(image);

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(normalized);
        if (!writers.hasNext()) {
            throw new UnsupportedImageFormatException("No writer for format '" + format + "'", null, format);
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(ios);
            ImageWriteParam param = writer.getDefaultWriteParam();
            if ("jpg".equals(normalized)) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(quality / 100f);
            }
            writer.write(null, new IIOImage(opaque, null, null), param);
        } finally {
            writer.dispose();
        }
    }
}
