package com.threadedmosaic;

import org.springframework.boot.Banner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Entry point for both front ends. {@code mosaic serve} starts the HTTP API and keeps running;
 * every other command runs once without a web server and exits with the command's code.
 */
@SpringBootApplication
public class ThreadedMosaicApplication {

    public static final String SERVE_COMMAND = "serve";

    public static void main(String[] args) {
        boolean serve = isServeCommand(args);

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(ThreadedMosaicApplication.class)
                .web(serve ? WebApplicationType.SERVLET : WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(serve)
                .run(args);

        if (!serve) {
            System.exit(SpringApplication.exit(ctx, ctx.getBean(ExitCodeGenerator.class)));
        }
    }

    /**
     * True when the subcommand, the first argument that is not an option, is {@code serve}.
     * A file that happens to be named "serve" further along the line does not count.
     */
    public static boolean isServeCommand(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return SERVE_COMMAND.equals(arg);
            }
        }
        return false;
    }
}
