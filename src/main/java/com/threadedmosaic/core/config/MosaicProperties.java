package com.threadedmosaic.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "mosaic")
public class MosaicProperties {

    private Processing processing = new Processing();
    private Seeds seeds = new Seeds();
    private Preview preview = new Preview();
    private Retention retention = new Retention();
    private Output output = new Output();

    // -- Flattened accessors (delegate to nested) --
    public int getMaxConcurrentOperations() { return processing.maxConcurrentOperations; }
    public int getTileParallelism() { return processing.tileParallelism; }
    public int getMaxTileSize() { return processing.maxTileSize; }
    public List<String> getSupportedExtensions() { return seeds.supportedExtensions; }
    public int getSeedWorkingDimension() { return seeds.workingDimension; }
    public int getPreviewMaxWidth() { return preview.maxWidth; }
    public int getPreviewMaxHeight() { return preview.maxHeight; }
    public String getPreviewFormat() { return preview.format; }
    public List<Integer> getPreviewMilestones() { return preview.milestones; }
    public Duration getRetentionWindow() { return retention.window; }
    public Duration getGracePeriod() { return retention.gracePeriod; }
    public Duration getCleanupInterval() { return retention.cleanupInterval; }
    public int getJpegQuality() { return output.jpegQuality; }

    /**
     * Returns true when the file name ends with one of the supported seed/master extensions.
     */
    public boolean isSupportedImage(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return false;
        }
        String ext = fileName.substring(dot + 1).toLowerCase();
        return seeds.supportedExtensions.contains(ext);
    }

    public Processing getProcessing() { return processing; }
    public void setProcessing(Processing processing) { this.processing = processing; }
    public Seeds getSeeds() { return seeds; }
    public void setSeeds(Seeds seeds) { this.seeds = seeds; }
    public Preview getPreview() { return preview; }
    public void setPreview(Preview preview) { this.preview = preview; }
    public Retention getRetention() { return retention; }
    public void setRetention(Retention retention) { this.retention = retention; }
    public Output getOutput() { return output; }
    public void setOutput(Output output) { this.output = output; }

    public static class Processing {
        private int maxConcurrentOperations = Math.max(1, Runtime.getRuntime().availableProcessors() / 2);
        private int tileParallelism = Runtime.getRuntime().availableProcessors();
        private int maxTileSize = 1000;

        public int getMaxConcurrentOperations() { return maxConcurrentOperations; }
        public void setMaxConcurrentOperations(int maxConcurrentOperations) { this.maxConcurrentOperations = maxConcurrentOperations; }
        public int getTileParallelism() { return tileParallelism; }
        public void setTileParallelism(int tileParallelism) { this.tileParallelism = tileParallelism; }
        public int getMaxTileSize() { return maxTileSize; }
        public void setMaxTileSize(int maxTileSize) { this.maxTileSize = maxTileSize; }
    }

    public static class Seeds {
        private List<String> supportedExtensions = new ArrayList<>(
                List.of("jpg", "jpeg", "png", "bmp", "gif", "tif", "tiff"));
        /** Longest edge kept in memory per seed once its average color is known. */
        private int workingDimension = 256;

        public List<String> getSupportedExtensions() { return supportedExtensions; }
        public void setSupportedExtensions(List<String> supportedExtensions) { this.supportedExtensions = supportedExtensions; }
        public int getWorkingDimension() { return workingDimension; }
        public void setWorkingDimension(int workingDimension) { this.workingDimension = workingDimension; }
    }

    public static class Preview {
        private int maxWidth = 400;
        private int maxHeight = 300;
        private String format = "png";
        private List<Integer> milestones = new ArrayList<>(List.of(25, 50, 75));

        public int getMaxWidth() { return maxWidth; }
        public void setMaxWidth(int maxWidth) { this.maxWidth = maxWidth; }
        public int getMaxHeight() { return maxHeight; }
        public void setMaxHeight(int maxHeight) { this.maxHeight = maxHeight; }
        public String getFormat() { return format; }
        public void setFormat(String format) { this.format = format; }
        public List<Integer> getMilestones() { return milestones; }
        public void setMilestones(List<Integer> milestones) { this.milestones = milestones; }
    }

    public static class Retention {
        private Duration window = Duration.ofHours(24);
        private Duration gracePeriod = Duration.ofHours(1);
        private Duration cleanupInterval = Duration.ofMinutes(5);

        public Duration getWindow() { return window; }
        public void setWindow(Duration window) { this.window = window; }
        public Duration getGracePeriod() { return gracePeriod; }
        public void setGracePeriod(Duration gracePeriod) { this.gracePeriod = gracePeriod; }
        public Duration getCleanupInterval() { return cleanupInterval; }
        public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
    }

    public static class Output {
        private int jpegQuality = 85;

        public int getJpegQuality() { return jpegQuality; }
        public void setJpegQuality(int jpegQuality) { this.jpegQuality = jpegQuality; }
    }
}
