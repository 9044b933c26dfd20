package com.phillippitts.voicegraph.domain;

/**
 * Immutable description of a raw PCM stream.
 *
 * <p>Equality is structural over all four fields. Two formats with the same bit depth but
 * different {@code isFloat} flags are not compatible.
 *
 * @param sampleRate samples per second per channel, must be positive
 * @param channels number of interleaved channels, must be positive
 * @param bitsPerSample sample width; one of 16, 24 or 32
 * @param isFloat {@code true} for IEEE-754 float samples, {@code false} for signed integer PCM
 */
public record AudioFormat(int sampleRate, int channels, int bitsPerSample, boolean isFloat) {

    /** 16 kHz, mono, 16-bit signed PCM. */
    public static final AudioFormat DEFAULT = new AudioFormat(16_000, 1, 16, false);

    /** 44.1 kHz, stereo, 16-bit signed PCM. */
    public static final AudioFormat CD = new AudioFormat(44_100, 2, 16, false);

    /** 48 kHz, stereo, 24-bit signed PCM. */
    public static final AudioFormat HIGH_QUALITY = new AudioFormat(48_000, 2, 24, false);

    public AudioFormat {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive: " + channels);
        }
        if (bitsPerSample != 16 && bitsPerSample != 24 && bitsPerSample != 32) {
            throw new IllegalArgumentException("bitsPerSample must be 16, 24 or 32: " + bitsPerSample);
        }
        if (isFloat && bitsPerSample != 32) {
            throw new IllegalArgumentException("float samples must be 32-bit");
        }
    }

    /**
     * Creates a 16-bit signed PCM format.
     */
    public static AudioFormat pcm16(int sampleRate, int channels) {
        return new AudioFormat(sampleRate, channels, 16, false);
    }

    /**
     * Creates a 32-bit float format.
     */
    public static AudioFormat float32(int sampleRate, int channels) {
        return new AudioFormat(sampleRate, channels, 32, true);
    }

    /** Bytes per sample. */
    public int bytesPerSample() {
        return bitsPerSample / 8;
    }

    /** Bytes per frame (one sample for every channel). */
    public int frameSize() {
        return channels * bitsPerSample / 8;
    }

    /** Bytes per second of audio in this format. */
    public int bytesPerSecond() {
        return sampleRate * frameSize();
    }

    public boolean isPcm16() {
        return bitsPerSample == 16 && !isFloat;
    }

    public boolean isFloat32() {
        return bitsPerSample == 32 && isFloat;
    }

    @Override
    public String toString() {
        return sampleRate + "Hz, " + channels + " channel(s), " + bitsPerSample + "-bit "
                + (isFloat ? "float" : "PCM");
    }
}
