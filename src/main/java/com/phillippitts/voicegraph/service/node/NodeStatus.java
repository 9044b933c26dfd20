package com.phillippitts.voicegraph.service.node;

import java.time.Duration;
import java.time.Instant;

/**
 * Typed node state that processing code reads back (as opposed to the free-form
 * diagnostics map, which is write-only from the node's point of view).
 *
 * <p>Thread-safe: all accessors are synchronized.
 */
public final class NodeStatus {

    private boolean initialized;
    private long processingCount;
    private Duration totalProcessingTime = Duration.ZERO;
    private Instant lastProcessedAt;
    private String lastError;
    private String lastTransportError;

    public synchronized boolean isInitialized() {
        return initialized;
    }

    synchronized void setInitialized(boolean initialized) {
        this.initialized = initialized;
    }

    public synchronized long getProcessingCount() {
        return processingCount;
    }

    public synchronized Duration getTotalProcessingTime() {
        return totalProcessingTime;
    }

    public synchronized double getAverageProcessingMillis() {
        return processingCount == 0 ? 0.0 : totalProcessingTime.toNanos() / 1_000_000.0 / processingCount;
    }

    public synchronized Instant getLastProcessedAt() {
        return lastProcessedAt;
    }

    public synchronized String getLastError() {
        return lastError;
    }

    public synchronized String getLastTransportError() {
        return lastTransportError;
    }

    public synchronized void recordProcessing(Duration elapsed) {
        processingCount++;
        totalProcessingTime = totalProcessingTime.plus(elapsed);
        lastProcessedAt = Instant.now();
    }

    public synchronized void recordError(String message) {
        this.lastError = message;
    }

    public synchronized void recordTransportError(String message) {
        this.lastTransportError = message;
    }

    synchronized void resetCounters() {
        processingCount = 0;
        totalProcessingTime = Duration.ZERO;
        lastProcessedAt = null;
    }
}
