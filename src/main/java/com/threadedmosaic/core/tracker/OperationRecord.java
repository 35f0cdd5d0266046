package com.threadedmosaic.core.tracker;

import com.threadedmosaic.core.model.MosaicOperation;
import com.threadedmosaic.core.model.MosaicRequest;
import com.threadedmosaic.core.model.OperationStatus;

import java.awt.image.BufferedImage;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable tracker state for one operation. Status changes go through compare-and-set so a
 * terminal status is never overwritten; progress only moves forward.
 */
final class OperationRecord {

    private final String id;
    private final MosaicRequest request;
    private final Instant createdAt;

    private final AtomicReference<OperationStatus> status = new AtomicReference<>(OperationStatus.QUEUED);
    private final AtomicInteger progress = new AtomicInteger();
    private final AtomicBoolean cancellationRequested = new AtomicBoolean();

    private volatile String currentStep = "queued";
    private volatile String resultPath;
    private volatile String errorMessage;
    private volatile int tileCount;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    private volatile BufferedImage canvas;

    /** Highest preview milestone already captured; guarded by {@code this}. */
    private int lastMilestone;

    OperationRecord(String id, MosaicRequest request, Instant createdAt) {
        this.id = id;
        this.request = request;
        this.createdAt = createdAt;
    }

    String id() { return id; }
    MosaicRequest request() { return request; }
    Instant createdAt() { return createdAt; }
    OperationStatus status() { return status.get(); }
    int progress() { return progress.get(); }
    String resultPath() { return resultPath; }
    Instant completedAt() { return completedAt; }
    BufferedImage canvas() { return canvas; }

    boolean isCancellationRequested() {
        return cancellationRequested.get();
    }

    void requestCancellation() {
        cancellationRequested.set(true);
    }

    boolean start(Instant now) {
        if (status.compareAndSet(OperationStatus.QUEUED, OperationStatus.RUNNING)) {
            startedAt = now;
            currentStep = "starting";
            return true;
        }
        return false;
    }

    void advance(int percent, String step) {
        progress.accumulateAndGet(percent, Math::max);
        currentStep = step;
    }

    void tileCount(int count) {
        this.tileCount = count;
    }

    void canvas(BufferedImage canvas) {
        this.canvas = canvas;
    }

    /**
     * Returns the milestone just crossed by {@code percent}, or -1 when none is new.
     */
    synchronized int crossMilestone(int percent, Iterable<Integer> milestones) {
        int crossed = -1;
        for (int m : milestones) {
            if (percent >= m && m > lastMilestone && m > crossed) {
                crossed = m;
            }
        }
        if (crossed > 0) {
            lastMilestone = crossed;
        }
        return crossed;
    }

    boolean complete(String path, Instant now) {
        resultPath = path;
        progress.set(100);
        return finish(OperationStatus.COMPLETED, "completed", now);
    }

    boolean fail(String message, Instant now) {
        errorMessage = message;
        return finish(OperationStatus.FAILED, "failed", now);
    }

    boolean cancel(Instant now) {
        return finish(OperationStatus.CANCELLED, "cancelled", now);
    }

    private boolean finish(OperationStatus target, String step, Instant now) {
        OperationStatus current = status.get();
        while (!current.isTerminal()) {
            completedAt = now;
            currentStep = step;
            if (status.compareAndSet(current, target)) {
                canvas = null;
                return true;
            }
            current = status.get();
        }
        return false;
    }

    MosaicOperation snapshot() {
        OperationStatus s = status.get();
        return new MosaicOperation(
                id,
                s,
                request.mosaicType(),
                progress.get(),
                currentStep,
                s == OperationStatus.COMPLETED ? resultPath : null,
                s == OperationStatus.FAILED ? errorMessage : null,
                cancellationRequested.get(),
                tileCount,
                createdAt,
                startedAt,
                completedAt);
    }
}
