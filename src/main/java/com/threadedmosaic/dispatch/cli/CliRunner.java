package com.threadedmosaic.dispatch.cli;

import com.threadedmosaic.ThreadedMosaicApplication;
import com.threadedmosaic.core.exception.MosaicException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the picocli command tree inside the Spring context and hands its exit code to Boot.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final MosaicCommand mosaicCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(MosaicCommand mosaicCommand, IFactory factory) {
        this.mosaicCommand = mosaicCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        // serve mode: the embedded web server keeps the JVM alive, picocli would return at once
        if (ThreadedMosaicApplication.isServeCommand(args)) {
            return;
        }
        exitCode = commandLine(mosaicCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Command line with lenient enum parsing ({@code --type hue}) and domain failures reported
     * as a one-line error with exit code 1 instead of a stack trace.
     */
    static CommandLine commandLine(MosaicCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    if (ex instanceof MosaicException) {
                        log.debug("Command {} failed", cmd.getCommandName(), ex);
                        ConsoleOutput.error(ex.getMessage());
                        return 1;
                    }
                    throw ex;
                });
    }
}
