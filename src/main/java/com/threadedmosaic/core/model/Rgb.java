package com.threadedmosaic.core.model;

import java.io.Serializable;

/**
 * An opaque 8-bit-per-channel RGB color.
 *
 * @param r red channel, 0..255
 * @param g green channel, 0..255
 * @param b blue channel, 0..255
 */
public record Rgb(int r, int g, int b) implements Serializable {

    public static final Rgb BLACK = new Rgb(0, 0, 0);
    public static final Rgb WHITE = new Rgb(255, 255, 255);

    public Rgb {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
    }

    /**
     * Builds a color from a packed {@code 0xAARRGGBB} value, ignoring alpha.
     */
    public static Rgb fromArgb(int argb) {
        return new Rgb((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF);
    }

    /** Packs this color as fully opaque {@code 0xFFRRGGBB}. */
    public int toArgb() {
        return 0xFF000000 | (r << 16) | (g << 8) | b;
    }

    public String toHex() {
        return String.format("#%02x%02x%02x", r, g, b);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Channel " + name + " out of range 0..255: " + value);
        }
    }
}
