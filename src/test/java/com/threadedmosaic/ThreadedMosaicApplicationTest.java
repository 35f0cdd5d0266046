package com.threadedmosaic;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThreadedMosaicApplicationTest {

    @Test
    @DisplayName("serve as the subcommand starts the server")
    void serve() {
        assertTrue(ThreadedMosaicApplication.isServeCommand("serve"));
        assertTrue(ThreadedMosaicApplication.isServeCommand("--spring.profiles.active=dev", "serve", "--server.port=9090"));
    }

    @Test
    @DisplayName("serve anywhere but the subcommand position runs the CLI")
    void serveAsArgument() {
        assertFalse(ThreadedMosaicApplication.isServeCommand("create", "serve", "out.png"));
        assertFalse(ThreadedMosaicApplication.isServeCommand("health"));
    }

    @Test
    @DisplayName("no subcommand runs the CLI, which prints usage")
    void noSubcommand() {
        assertFalse(ThreadedMosaicApplication.isServeCommand());
        assertFalse(ThreadedMosaicApplication.isServeCommand("--help"));
    }
}
