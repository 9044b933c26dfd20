package com.phillippitts.voicegraph.testutil;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.service.audio.PcmSamples;

import java.util.Arrays;

/**
 * Builders for small PCM buffers used across tests.
 */
public final class AudioFixtures {

    private AudioFixtures() {
        // Utility class
    }

    /**
     * 16-bit little-endian buffer holding the given samples.
     */
    public static AudioBuffer pcm16(AudioFormat format, int... samples) {
        byte[] data = new byte[samples.length * 2];
        for (int i = 0; i < samples.length; i++) {
            PcmSamples.writeInt16(data, i * 2, samples[i]);
        }
        return new AudioBuffer(data, format);
    }

    public static AudioBuffer constantPcm16(int sampleCount, int value) {
        int[] samples = new int[sampleCount];
        Arrays.fill(samples, value);
        return pcm16(AudioFormat.DEFAULT, samples);
    }

    public static int[] samplesOf(AudioBuffer buffer) {
        byte[] data = buffer.rawData();
        int[] samples = new int[data.length / 2];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = PcmSamples.readInt16(data, i * 2);
        }
        return samples;
    }
}
