package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Instant;

/**
 * Published when a speech synthesis service signalled the end of an utterance.
 */
public record SpeechCompletedEvent(String nodeId, boolean success, ProcessingContext context, Instant at) {
    public SpeechCompletedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
