package com.threadedmosaic.core.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one part of the mosaic engine.
 *
 * @param component short name: codecs, operations, tiles or tracker
 * @param level     verdict for this component
 * @param detail    one-line summary for humans
 * @param gauges    the counts behind the verdict, in insertion order
 */
public record ComponentHealth(String component, Level level, String detail, Map<String, Integer> gauges) {

    /** Declared from healthy to unhealthy; {@link #worse} relies on the order. */
    public enum Level {
        UP, DEGRADED, DOWN;

        public Level worse(Level other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public ComponentHealth {
        gauges = Collections.unmodifiableMap(new LinkedHashMap<>(gauges));
    }

    static ComponentHealth up(String component, String detail, Map<String, Integer> gauges) {
        return new ComponentHealth(component, Level.UP, detail, gauges);
    }

    static ComponentHealth degraded(String component, String detail, Map<String, Integer> gauges) {
        return new ComponentHealth(component, Level.DEGRADED, detail, gauges);
    }

    static ComponentHealth down(String component, String detail) {
        return new ComponentHealth(component, Level.DOWN, detail, Map.of());
    }
}
