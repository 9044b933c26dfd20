package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Instant;

/**
 * Published when a transcription service delivered an interim or final transcript.
 *
 * <p>PII note: listeners must not log {@code text} in full; use
 * {@link com.phillippitts.voicegraph.util.LogSanitizer}.
 */
public record TranscriptionReceivedEvent(
        String nodeId,
        String text,
        boolean isFinal,
        ProcessingContext context,
        Instant at
) {
    public TranscriptionReceivedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
