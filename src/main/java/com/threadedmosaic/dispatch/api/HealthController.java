package com.threadedmosaic.dispatch.api;

import com.threadedmosaic.core.health.ComponentHealth;
import com.threadedmosaic.core.health.HealthCheckService;
import com.threadedmosaic.core.health.MosaicHealthReport;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Engine health: codecs, the operation and tile pools, and the tracker.
 * A DOWN verdict answers 503 so load balancers can act on the status code alone.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private final HealthCheckService healthCheckService;

    public HealthController(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @GetMapping
    public ResponseEntity<HealthResponse> health() {
        if (healthCheckService == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(HealthResponse.unavailable());
        }
        MosaicHealthReport report = healthCheckService.report();
        return ResponseEntity.status(report.isDown() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK)
                .body(HealthResponse.from(report));
    }

    /**
     * GET /api/v1/health/{component}: one component, 404 when the name is unknown.
     */
    @GetMapping("/{component}")
    public ResponseEntity<HealthResponse.Component> component(@PathVariable String component) {
        if (healthCheckService == null) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
        return healthCheckService.report().component(component)
                .map(c -> ResponseEntity.status(c.level() == ComponentHealth.Level.DOWN
                                ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK)
                        .body(HealthResponse.Component.from(c)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
