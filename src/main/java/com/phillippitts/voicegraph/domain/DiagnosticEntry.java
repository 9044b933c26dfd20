package com.phillippitts.voicegraph.domain;

import java.time.Instant;

/**
 * One line of a {@link ProcessingContext}'s diagnostic log.
 */
public record DiagnosticEntry(Level level, String message, Instant timestamp) {

    public enum Level {
        INFO,
        WARNING,
        ERROR
    }

    public DiagnosticEntry {
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }
}
