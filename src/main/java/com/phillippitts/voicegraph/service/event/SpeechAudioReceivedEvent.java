package com.phillippitts.voicegraph.service.event;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.ProcessingContext;

import java.time.Instant;

/**
 * Published when a speech synthesis service returned a chunk of audio.
 */
public record SpeechAudioReceivedEvent(
        String nodeId,
        AudioBuffer audio,
        ProcessingContext context,
        Instant at
) {
    public SpeechAudioReceivedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
