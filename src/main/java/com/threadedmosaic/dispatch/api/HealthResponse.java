package com.threadedmosaic.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.threadedmosaic.core.health.ComponentHealth;
import com.threadedmosaic.core.health.MosaicHealthReport;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON view of a health report, components keyed by name.
 */
public record HealthResponse(
    String status,
    @JsonProperty("checked_at") Instant checkedAt,
    Map<String, Component> components
) {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record Component(String status, String detail, Map<String, Integer> gauges) {

        static Component from(ComponentHealth health) {
            return new Component(health.level().name(), health.detail(), health.gauges());
        }
    }

    public static HealthResponse from(MosaicHealthReport report) {
        var components = new LinkedHashMap<String, Component>();
        for (ComponentHealth health : report.components()) {
            components.put(health.component(), Component.from(health));
        }
        return new HealthResponse(report.overall().name(), report.checkedAt(), components);
    }

    static HealthResponse unavailable() {
        return new HealthResponse(ComponentHealth.Level.DOWN.name(), Instant.now(), Map.of());
    }
}
