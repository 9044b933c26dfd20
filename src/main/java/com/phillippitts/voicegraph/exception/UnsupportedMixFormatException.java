package com.phillippitts.voicegraph.exception;

import com.phillippitts.voicegraph.domain.AudioFormat;

/**
 * Thrown when buffers cannot be mixed: their formats differ, or the shared format is
 * neither 16-bit PCM nor 32-bit float.
 */
public class UnsupportedMixFormatException extends VoiceGraphException {

    private final AudioFormat format;

    public UnsupportedMixFormatException(AudioFormat format, String message) {
        super(message + ": " + format);
        this.format = format;
    }

    public AudioFormat getFormat() {
        return format;
    }
}
