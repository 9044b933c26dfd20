package com.phillippitts.voicegraph.service.node;

/**
 * Outcome of the last {@link NodeConnection#validate()} call.
 */
public enum ConnectionValidationState {
    NOT_VALIDATED,
    VALID,
    /** A node self-check failed; formats and capabilities were compatible. */
    INVALID,
    /** Formats or capabilities mismatch; unusable until reconfigured. */
    INCOMPATIBLE
}
