package com.threadedmosaic.dispatch.cli;

import com.threadedmosaic.core.health.ComponentHealth;
import com.threadedmosaic.core.health.HealthCheckService;
import com.threadedmosaic.core.health.MosaicHealthReport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * CLI command: mosaic health [--component NAME]
 * <p>
 * Exit code 0 while nothing is DOWN, 1 otherwise or when the check cannot run, 2 for an
 * unknown component name.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check image codecs, worker pools and the operation tracker")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = {"--component", "-c"}, description = "Only check one of: codecs, operations, tiles, tracker")
    private String component;

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        MosaicHealthReport report = healthCheckService.report();
        List<ComponentHealth> shown = report.components();
        if (component != null) {
            var match = report.component(component);
            if (match.isEmpty()) {
                ConsoleOutput.error("Unknown component '" + component + "'");
                return 2;
            }
            shown = List.of(match.get());
        }

        ComponentHealth.Level overall = ComponentHealth.Level.UP;
        for (ComponentHealth health : shown) {
            print(health);
            overall = overall.worse(health.level());
        }

        System.out.println("──────────────────────────────────");
        switch (overall) {
            case UP -> ConsoleOutput.success("Overall: UP");
            case DEGRADED -> ConsoleOutput.warn("Overall: DEGRADED");
            case DOWN -> ConsoleOutput.error("Overall: DOWN");
        }
        return overall == ComponentHealth.Level.DOWN ? 1 : 0;
    }

    private static void print(ComponentHealth health) {
        String line = health.component() + ": " + health.detail() + gauges(health.gauges());
        switch (health.level()) {
            case UP -> ConsoleOutput.success(line);
            case DEGRADED -> ConsoleOutput.warn(line);
            case DOWN -> ConsoleOutput.error(line);
        }
    }

    static String gauges(Map<String, Integer> gauges) {
        if (gauges.isEmpty()) {
            return "";
        }
        return gauges.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", " (", ")"));
    }
}
