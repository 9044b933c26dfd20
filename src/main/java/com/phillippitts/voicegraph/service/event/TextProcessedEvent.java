package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Instant;

/**
 * Published by a text processing node after running its processor chain.
 */
public record TextProcessedEvent(
        String nodeId,
        String inputText,
        String outputText,
        ProcessingContext context,
        Instant at
) {
    public TextProcessedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
