package com.phillippitts.voicegraph.exception;

import com.phillippitts.voicegraph.domain.AudioFormat;

/**
 * Thrown when an audio buffer cannot be converted between the requested formats.
 * Only 16-bit PCM and 32-bit float at identical sample rate and channel count are supported.
 */
public class UnsupportedConversionException extends VoiceGraphException {

    private final AudioFormat sourceFormat;
    private final AudioFormat targetFormat;

    public UnsupportedConversionException(AudioFormat sourceFormat, AudioFormat targetFormat) {
        super("Conversion from " + sourceFormat + " to " + targetFormat + " is not supported");
        this.sourceFormat = sourceFormat;
        this.targetFormat = targetFormat;
    }

    public AudioFormat getSourceFormat() {
        return sourceFormat;
    }

    public AudioFormat getTargetFormat() {
        return targetFormat;
    }
}
