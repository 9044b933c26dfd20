package com.phillippitts.voicegraph.domain;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owner of a cancellation scope. Cancelling is idempotent; closing a source that was never
 * cancelled leaves its token uncancelled.
 */
public final class CancellationSource implements AutoCloseable {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CancellationToken token = cancelled::get;

    public CancellationToken token() {
        return token;
    }

    /**
     * Signals cancellation to every holder of {@link #token()}.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
