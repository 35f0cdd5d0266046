package com.threadedmosaic.core.engine;

import com.threadedmosaic.core.events.EventBus;
import com.threadedmosaic.core.events.MosaicEvent;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Default {@link ProgressSink}: republishes progress as {@code operation.progress} events.
 */
@Component
public class EventBusProgressSink implements ProgressSink {

    private final EventBus eventBus;

    public EventBusProgressSink(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void report(String operationId, int percent, String step) {
        eventBus.publish(MosaicEvent.of(MosaicEvent.PROGRESS, operationId,
                Map.of("percent", percent, "step", step)));
    }
}
