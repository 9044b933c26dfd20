package com.phillippitts.voicegraph.domain;

/**
 * Read side of a cooperative cancellation signal.
 *
 * <p>Work checks {@link #isCancellationRequested()} at its next suspension point; nothing is
 * forcibly interrupted.
 *
 * @see CancellationSource
 */
public interface CancellationToken {

    /** A token that is never cancelled. */
    CancellationToken NONE = () -> false;

    boolean isCancellationRequested();
}
