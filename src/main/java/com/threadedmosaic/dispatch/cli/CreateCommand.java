package com.threadedmosaic.dispatch.cli;

import com.threadedmosaic.core.exception.MosaicValidationException;
import com.threadedmosaic.core.model.MosaicOperation;
import com.threadedmosaic.core.model.MosaicOptions;
import com.threadedmosaic.core.model.MosaicRequest;
import com.threadedmosaic.core.model.MosaicType;
import com.threadedmosaic.core.model.OperationStatus;
import com.threadedmosaic.core.tracker.OperationTracker;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: mosaic create &lt;master&gt; &lt;output&gt; [--type] [--seeds] [--tile-size] [--quality]
 * [--format] [--thumbnail-width] [--thumbnail-height] [--max-reuse]
 * <p>
 * Submits a build and follows it until it reaches a terminal state, printing progress as it
 * advances. Exit code 0 on success, 1 on failure or cancellation, 2 on a rejected request.
 */
@Command(name = "create", mixinStandardHelpOptions = true, description = "Build a mosaic and wait for it")
@Component
public class CreateCommand implements Callable<Integer> {

    static final long POLL_INTERVAL_MS = 250;

    @Parameters(index = "0", description = "Master image to reproduce")
    private Path master;

    @Parameters(index = "1", description = "Output file; its extension selects the format")
    private Path output;

    @Option(names = {"--type", "-t"}, defaultValue = "PHOTO",
            description = "Mosaic type: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private MosaicType type;

    @Option(names = {"--seeds", "-s"}, description = "Directory of seed images (HUE and PHOTO)")
    private Path seeds;

    @Option(names = {"--tile-size", "-z"}, defaultValue = "20", description = "Tile edge in pixels (default: ${DEFAULT-VALUE})")
    private int tileSize;

    @Option(names = "--quality", description = "JPEG quality 1..100 (default: configured)")
    private Integer quality;

    @Option(names = "--format", description = "Output format, overriding the output extension: jpg, png, bmp or gif")
    private String format;

    @Option(names = "--thumbnail-width", description = "Preview width bound in pixels (default: configured)")
    private Integer thumbnailWidth;

    @Option(names = "--thumbnail-height", description = "Preview height bound in pixels (default: configured)")
    private Integer thumbnailHeight;

    @Option(names = "--max-reuse", description = "PHOTO only: tiles one seed may fill before others are preferred")
    private Integer maxReuse;

    private final OperationTracker tracker;

    public CreateCommand(OperationTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        String id;
        try {
            id = tracker.submit(new MosaicRequest(master, seeds, tileSize, type, output, options())).orThrow();
        } catch (MosaicValidationException e) {
            ConsoleOutput.error("Request rejected:");
            for (String error : e.getErrors()) {
                ConsoleOutput.error("  " + error);
            }
            return 2;
        }
        ConsoleOutput.info(type + " mosaic queued as " + id);

        MosaicOperation last;
        try {
            last = follow(id);
        } catch (InterruptedException e) {
            tracker.cancel(id);
            Thread.currentThread().interrupt();
            ConsoleOutput.warn("Interrupted; cancellation requested for " + id);
            return 1;
        }
        if (last == null) {
            ConsoleOutput.error("Operation " + id + " is no longer tracked");
            return 1;
        }
        ConsoleOutput.summary(last);
        return last.status() == OperationStatus.COMPLETED ? 0 : 1;
    }

    private MosaicOptions options() {
        return new MosaicOptions(quality, format, thumbnailWidth, thumbnailHeight,
                maxReuse != null, maxReuse == null ? 0 : maxReuse);
    }

    private MosaicOperation follow(String id) throws InterruptedException {
        int lastPercent = -1;
        String lastStep = null;
        while (true) {
            Optional<MosaicOperation> current = tracker.getStatus(id);
            if (current.isEmpty()) {
                return null;
            }
            MosaicOperation op = current.get();
            if (op.progressPercent() != lastPercent
                    || (op.currentStep() != null && !op.currentStep().equals(lastStep) && !op.currentStep().startsWith("analyzing"))) {
                ConsoleOutput.progress(op.progressPercent(), op.currentStep());
                lastPercent = op.progressPercent();
                lastStep = op.currentStep();
            }
            if (op.status().isTerminal()) {
                return op;
            }
            Thread.sleep(POLL_INTERVAL_MS);
        }
    }
}
