package com.threadedmosaic.core.image;

import com.threadedmosaic.core.exception.UnsupportedImageFormatException;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Stateless raster helpers shared by the strategies, the seed catalog and the image codec.
 */
public final class ImageOps {

    public static final Set<String> WRITABLE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "bmp", "gif");

    private ImageOps() {}

    /**
     * Lower-cased file extension, or an empty string when the name has none.
     */
    public static String extension(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Output format name understood by {@code ImageIO} for the given target path.
     *
     * @throws UnsupportedImageFormatException when the extension has no writer
     */
    public static String outputFormat(Path path) {
        return formatName(extension(path), path);
    }

    /**
     * Output format for {@code path}, with an explicit {@code override} taking precedence over
     * the extension when it is not null.
     *
     * @throws UnsupportedImageFormatException when the chosen name has no writer
     */
    public static String outputFormat(Path path, String override) {
        if (override == null) {
            return outputFormat(path);
        }
        return formatName(override.trim().toLowerCase(Locale.ROOT), path);
    }

    private static String formatName(String name, Path path) {
        return switch (name) {
            case "jpg", "jpeg" -> "jpg";
            case "png", "bmp", "gif" -> name;
            default -> throw new UnsupportedImageFormatException(
                    "Unsupported output format '" + name + "'", path, name);
        };
    }

    /**
     * Scales the source so it covers {@code width x height}, then crops the centre.
     */
    public static BufferedImage scaleToCover(BufferedImage source, int width, int height) {
        double scale = Math.max((double) width / source.getWidth(), (double) height / source.getHeight());
        int scaledW = Math.max(width, (int) Math.ceil(source.getWidth() * scale));
        int scaledH = Math.max(height, (int) Math.ceil(source.getHeight() * scale));
        int offsetX = (scaledW - width) / 2;
        int offsetY = (scaledH - height) / 2;

        var out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            applyQualityHints(g);
            g.drawImage(source, -offsetX, -offsetY, scaledW, scaledH, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /**
     * Scales the source down to fit within the bounds, keeping its aspect ratio.
     * Never upscales; an image already within bounds is copied as-is.
     */
    public static BufferedImage fitWithin(BufferedImage source, int maxWidth, int maxHeight) {
        double scale = Math.min(1.0, Math.min(
                (double) maxWidth / source.getWidth(), (double) maxHeight / source.getHeight()));
        int w = Math.max(1, (int) Math.round(source.getWidth() * scale));
        int h = Math.max(1, (int) Math.round(source.getHeight() * scale));

        var out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            applyQualityHints(g);
            g.drawImage(source, 0, 0, w, h, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /**
     * Returns the image unchanged when it is already {@code TYPE_INT_RGB}, otherwise an opaque copy.
     * JPEG and BMP writers reject images with an alpha channel.
     */
    public static BufferedImage toRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        return snapshot(source);
    }

    /**
     * Pixel copy of an image, safe to encode while the original keeps changing.
     */
    public static BufferedImage snapshot(BufferedImage source) {
        var out = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static void applyQualityHints(Graphics2D g) {
        g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
    }
}
