package com.threadedmosaic.core.seed;

import com.threadedmosaic.core.model.Rgb;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * One decoded seed: its catalog position, source file, average color of the full-resolution
 * image, and the working copy used to cut tile patches.
 */
public record SeedImage(int index, Path path, Rgb averageColor, BufferedImage image) {}
