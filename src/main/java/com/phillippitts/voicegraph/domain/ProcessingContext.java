package com.phillippitts.voicegraph.domain;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-invocation scope that flows through one propagation pass.
 *
 * <p>Carries:
 * <ul>
 *   <li><b>Session data:</b> survives across passes that share the same logical session</li>
 *   <li><b>Transient data:</b> scratch values for the current pass only; the pipeline
 *       clears it when the pass ends</li>
 *   <li><b>Cancellation:</b> a {@link CancellationToken} checked cooperatively by nodes</li>
 *   <li><b>Diagnostic log:</b> append-only list of {@link DiagnosticEntry} lines</li>
 * </ul>
 *
 * <p>Thread-safe: the maps and the log may be touched by nodes running on different threads
 * (for example a WebSocket receive loop and the caller of {@code execute}).
 */
public class ProcessingContext {

    private final UUID sessionId;
    private final Map<String, Object> sessionData = new ConcurrentHashMap<>();
    private final Map<String, Object> transientData = new ConcurrentHashMap<>();
    private final CancellationToken cancellationToken;
    private final List<DiagnosticEntry> log = new CopyOnWriteArrayList<>();
    private final Instant startTime;
    private volatile Instant lastUpdated;

    public ProcessingContext() {
        this(null, null);
    }

    /**
     * @param sessionId session identifier, or {@code null} to generate one
     * @param cancellationToken cancellation signal, or {@code null} for {@link CancellationToken#NONE}
     */
    public ProcessingContext(UUID sessionId, CancellationToken cancellationToken) {
        this.sessionId = sessionId != null ? sessionId : UUID.randomUUID();
        this.cancellationToken = cancellationToken != null ? cancellationToken : CancellationToken.NONE;
        this.startTime = Instant.now();
        this.lastUpdated = startTime;
    }

    public UUID getSessionId() {
        return sessionId;
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public boolean isCancellationRequested() {
        return cancellationToken.isCancellationRequested();
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getLastUpdated() {
        return lastUpdated;
    }

    public <T> T getSessionData(String key, Class<T> type, T defaultValue) {
        return typed(sessionData.get(key), type, defaultValue);
    }

    /**
     * Stores a session value; a {@code null} value removes the key.
     */
    public void setSessionData(String key, Object value) {
        put(sessionData, key, value);
        lastUpdated = Instant.now();
    }

    public <T> T getTransientData(String key, Class<T> type, T defaultValue) {
        return typed(transientData.get(key), type, defaultValue);
    }

    /**
     * Stores a pass-scoped value; a {@code null} value removes the key.
     */
    public void setTransientData(String key, Object value) {
        put(transientData, key, value);
    }

    public void removeTransientData(String key) {
        transientData.remove(key);
    }

    public boolean hasTransientData(String key) {
        return transientData.containsKey(key);
    }

    /**
     * Drops all pass-scoped values. Called by the pipeline when a pass finishes.
     */
    public void clearTransientData() {
        transientData.clear();
    }

    public Map<String, Object> getSessionDataView() {
        return Map.copyOf(sessionData);
    }

    public void logInfo(String message) {
        log.add(new DiagnosticEntry(DiagnosticEntry.Level.INFO, message, null));
    }

    public void logWarning(String message) {
        log.add(new DiagnosticEntry(DiagnosticEntry.Level.WARNING, message, null));
    }

    public void logError(String message) {
        log.add(new DiagnosticEntry(DiagnosticEntry.Level.ERROR, message, null));
    }

    /**
     * Snapshot of the diagnostic log in append order.
     */
    public List<DiagnosticEntry> getLog() {
        return List.copyOf(log);
    }

    private static void put(Map<String, Object> map, String key, Object value) {
        if (value == null) {
            map.remove(key);
        } else {
            map.put(key, value);
        }
    }

    private static <T> T typed(Object value, Class<T> type, T defaultValue) {
        return type.isInstance(value) ? type.cast(value) : defaultValue;
    }
}
