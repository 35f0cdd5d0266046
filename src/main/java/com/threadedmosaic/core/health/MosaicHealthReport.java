package com.threadedmosaic.core.health;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time health of the engine. The overall level is the worst component level.
 */
public record MosaicHealthReport(ComponentHealth.Level overall, List<ComponentHealth> components, Instant checkedAt) {

    public static MosaicHealthReport of(List<ComponentHealth> components, Instant checkedAt) {
        ComponentHealth.Level overall = ComponentHealth.Level.UP;
        for (ComponentHealth component : components) {
            overall = overall.worse(component.level());
        }
        return new MosaicHealthReport(overall, List.copyOf(components), checkedAt);
    }

    public boolean isDown() {
        return overall == ComponentHealth.Level.DOWN;
    }

    public Optional<ComponentHealth> component(String name) {
        return components.stream().filter(c -> c.component().equals(name)).findFirst();
    }
}
