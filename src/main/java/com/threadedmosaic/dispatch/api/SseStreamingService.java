package com.threadedmosaic.dispatch.api;

import com.threadedmosaic.core.events.EventBus;
import com.threadedmosaic.core.events.MosaicEvent;
import com.threadedmosaic.core.model.MosaicOperation;
import com.threadedmosaic.core.tracker.OperationTracker;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Streams one mosaic operation's lifecycle to an SSE client.
 * <p>
 * A new stream starts with an {@value #SNAPSHOT} event carrying the operation's current state, so
 * a client that connects late still sees where the build is. Streams for operations that are
 * already finished end right after that snapshot. Progress events that would move the client's
 * percentage backwards are dropped. Open streams get a keep-alive comment every
 * {@value #KEEPALIVE_SECONDS} seconds.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    static final String SNAPSHOT = "operation.snapshot";

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long KEEPALIVE_SECONDS = 30;

    private final EventBus eventBus;
    private final Function<String, Optional<MosaicOperation>> statusLookup;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<OperationStream> streams = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService keepalive = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "mosaic-sse-keepalive");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus, OperationTracker tracker) {
        this(eventBus, tracker::getStatus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, Function<String, Optional<MosaicOperation>> statusLookup, long timeoutMs) {
        this.eventBus = eventBus;
        this.statusLookup = statusLookup;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startKeepalive() {
        keepalive.scheduleAtFixedRate(this::sendKeepalive, KEEPALIVE_SECONDS, KEEPALIVE_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopKeepalive() {
        keepalive.shutdownNow();
        streams.forEach(stream -> stream.emitter.complete());
    }

    /**
     * Opens a stream for one operation. The emitter is already complete when the operation is
     * unknown or finished.
     */
    public SseEmitter createEmitter(String operationId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        var stream = new OperationStream(operationId, emitter);

        // subscribe before reading the snapshot so no event falls between the two
        stream.subscription = eventBus.subscribe(operationId, event -> forward(stream, event));

        Optional<MosaicOperation> current = statusLookup.apply(operationId);
        if (current.isEmpty() || current.get().status().isTerminal()) {
            stream.subscription.unsubscribe();
            current.ifPresent(op -> send(stream, SNAPSHOT, snapshotData(op)));
            emitter.complete();
            log.debug("Stream for {} closed at once ({})", operationId,
                    current.map(op -> op.status().name()).orElse("unknown"));
            return emitter;
        }

        streams.add(stream);
        emitter.onCompletion(() -> close(stream));
        emitter.onTimeout(() -> close(stream));
        emitter.onError(ex -> close(stream));

        MosaicOperation op = current.get();
        stream.lastPercent.accumulateAndGet(op.progressPercent(), Math::max);
        send(stream, SNAPSHOT, snapshotData(op));
        log.info("SSE stream opened for {} at {}% (timeout={}ms)", operationId, op.progressPercent(), timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return streams.size();
    }

    private void forward(OperationStream stream, MosaicEvent event) {
        if (MosaicEvent.PROGRESS.equals(event.eventType()) && !stream.advancesTo(event)) {
            return;
        }
        send(stream, event.eventType(), eventData(event));
        if (event.isTerminal()) {
            stream.emitter.complete();
        }
    }

    static Map<String, Object> snapshotData(MosaicOperation op) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operationId", op.id());
        data.put("status", op.status().name());
        data.put("mosaicType", op.mosaicType().name());
        data.put("percent", op.progressPercent());
        data.put("step", op.currentStep());
        data.put("tileCount", op.tileCount());
        if (op.resultPath() != null) {
            data.put("resultPath", op.resultPath());
        }
        if (op.errorMessage() != null) {
            data.put("error", op.errorMessage());
        }
        return data;
    }

    static Map<String, Object> eventData(MosaicEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("operationId", event.operationId());
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void send(OperationStream stream, String name, Map<String, Object> data) {
        try {
            stream.emitter.send(SseEmitter.event().name(name).data(data));
        } catch (IOException | IllegalStateException e) {
            // the emitter's own callbacks close the stream
            log.debug("Dropped {} for {}: {}", name, stream.operationId, e.getMessage());
        }
    }

    private void sendKeepalive() {
        for (OperationStream stream : streams) {
            try {
                stream.emitter.send(SseEmitter.event().comment("keepalive"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Keep-alive failed for {}: {}", stream.operationId, e.getMessage());
            }
        }
    }

    private void close(OperationStream stream) {
        stream.subscription.unsubscribe();
        streams.remove(stream);
    }

    private static final class OperationStream {

        final String operationId;
        final SseEmitter emitter;
        final AtomicInteger lastPercent = new AtomicInteger(-1);
        volatile EventBus.Subscription subscription;

        OperationStream(String operationId, SseEmitter emitter) {
            this.operationId = operationId;
            this.emitter = emitter;
        }

        boolean advancesTo(MosaicEvent progress) {
            if (!(progress.payload().get("percent") instanceof Integer percent)) {
                return true;
            }
            int previous = lastPercent.getAndAccumulate(percent, Math::max);
            return percent >= previous;
        }
    }
}
