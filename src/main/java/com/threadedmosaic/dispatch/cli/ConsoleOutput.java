package com.threadedmosaic.dispatch.cli;

import com.threadedmosaic.core.model.MosaicOperation;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the CLI.
 */
public class ConsoleOutput {

    private static final String RULE = "──────────────────────────────────";

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) THREADED MOSAIC v0.1.0|@"));
        System.out.println(RULE);
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [MOSAIC]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * One progress line, e.g. {@code [ 42%] analyzing tile 21 of 50}.
     */
    public static void progress(int percent, String step) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("@|fg(blue) [%3d%%]|@ %s", percent, step)));
    }

    public static void summary(MosaicOperation op) {
        System.out.println(RULE);
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Operation " + op.id() + "|@"));
        System.out.println("  Type:     " + op.mosaicType());
        System.out.println("  Tiles:    " + op.tileCount());
        if (op.startedAt() != null && op.completedAt() != null) {
            System.out.println("  Duration: " + formatDuration(
                    op.completedAt().toEpochMilli() - op.startedAt().toEpochMilli()));
        }
        switch (op.status()) {
            case COMPLETED -> success("Mosaic written to " + op.resultPath());
            case CANCELLED -> warn("Cancelled at " + op.progressPercent() + "%");
            case FAILED -> error("Failed: " + op.errorMessage());
            default -> info("Status: " + op.status());
        }
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
