package com.threadedmosaic.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: create, health, serve.
 */
@Command(
        name = "mosaic",
        mixinStandardHelpOptions = true,
        version = "Threaded Mosaic 0.1.0",
        description = "Builds photo mosaics from a master image and a folder of seed images",
        subcommands = {
                CreateCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class MosaicCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        spec.commandLine().usage(System.out);
    }
}
