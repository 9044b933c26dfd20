package com.phillippitts.voicegraph.service.audio;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.exception.UnsupportedMixFormatException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Per-sample mixing policy shared by the two-buffer utility and the mixer node.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Walk sample positions up to the longest source</li>
 *   <li>Sum {@code sample * gain} over every source that has data at the position
 *       (shorter sources contribute silence past their end)</li>
 *   <li>Optionally divide by the number of contributing sources</li>
 *   <li>Clamp to the 16-bit range, or to [-1, 1] for float samples</li>
 * </ol>
 *
 * <p>Only 16-bit PCM and 32-bit float are mixable, and all sources must share one format.
 *
 * @since 1.0
 */
public final class AudioMixing {

    /** Metadata key recording how many buffers went into a mix. */
    public static final String META_MIXED_BUFFERS = "mixedBuffers";

    private AudioMixing() {
        // Utility class
    }

    /**
     * Raw sum of two buffers with unit gains.
     */
    public static AudioBuffer mix(AudioBuffer first, AudioBuffer second) {
        return mix(first, second, 1.0, 1.0);
    }

    /**
     * Raw sum of two buffers with explicit per-buffer gains (no normalization).
     *
     * @throws UnsupportedMixFormatException if the formats differ or are not mixable
     */
    public static AudioBuffer mix(AudioBuffer first, AudioBuffer second, double firstGain, double secondGain) {
        if (!first.format().equals(second.format())) {
            throw new UnsupportedMixFormatException(first.format(),
                    "Cannot mix " + first.format() + " with " + second.format());
        }
        int channels = first.format().channels();
        List<double[]> gains = List.of(filled(channels, firstGain), filled(channels, secondGain));
        return combine(List.of(first, second), gains, false);
    }

    /**
     * Mixes N same-format sources with one per-channel weight vector.
     *
     * @param channelWeights weight per channel; missing entries default to 1.0
     * @param normalize divide each sample by the number of contributing sources
     * @throws UnsupportedMixFormatException if the formats differ or are not mixable
     */
    public static AudioBuffer mixSources(List<AudioBuffer> sources, double[] channelWeights, boolean normalize) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("At least one source is required");
        }
        AudioFormat format = sources.get(0).format();
        List<double[]> gains = new ArrayList<>(sources.size());
        double[] weights = weightsFor(format.channels(), channelWeights);
        for (AudioBuffer source : sources) {
            if (!source.format().equals(format)) {
                throw new UnsupportedMixFormatException(source.format(),
                        "Cannot mix " + source.format() + " with " + format);
            }
            gains.add(weights);
        }
        return combine(sources, gains, normalize);
    }

    public static boolean isMixable(AudioFormat format) {
        return format.isPcm16() || format.isFloat32();
    }

    private static AudioBuffer combine(List<AudioBuffer> sources, List<double[]> gains, boolean normalize) {
        AudioFormat format = sources.get(0).format();
        if (!isMixable(format)) {
            throw new UnsupportedMixFormatException(format, "Mixing supports 16-bit PCM and 32-bit float only");
        }
        int bytesPerSample = format.bytesPerSample();
        int channels = format.channels();
        boolean floatSamples = format.isFloat32();

        List<byte[]> data = new ArrayList<>(sources.size());
        int maxLength = 0;
        for (AudioBuffer source : sources) {
            byte[] bytes = source.rawData();
            data.add(bytes);
            maxLength = Math.max(maxLength, bytes.length);
        }

        byte[] out = new byte[maxLength];
        for (int offset = 0; offset + bytesPerSample <= maxLength; offset += bytesPerSample) {
            int channel = (offset / bytesPerSample) % channels;
            double sum = 0.0;
            int contributing = 0;
            for (int s = 0; s < data.size(); s++) {
                byte[] bytes = data.get(s);
                if (offset + bytesPerSample > bytes.length) {
                    continue;
                }
                double sample = floatSamples
                        ? PcmSamples.readFloat32(bytes, offset)
                        : PcmSamples.readInt16(bytes, offset);
                sum += sample * gains.get(s)[channel];
                contributing++;
            }
            if (contributing == 0) {
                continue;
            }
            double value = normalize ? sum / contributing : sum;
            if (floatSamples) {
                PcmSamples.writeFloat32(out, offset, PcmSamples.clampUnit(value));
            } else {
                PcmSamples.writeInt16(out, offset, PcmSamples.clampInt16(value));
            }
        }

        AudioBuffer mixed = new AudioBuffer(out, format);
        mixed.metadata().put(META_MIXED_BUFFERS, sources.size());
        return mixed;
    }

    private static double[] weightsFor(int channels, double[] channelWeights) {
        double[] weights = filled(channels, 1.0);
        if (channelWeights != null) {
            System.arraycopy(channelWeights, 0, weights, 0, Math.min(channels, channelWeights.length));
        }
        return weights;
    }

    private static double[] filled(int length, double value) {
        double[] values = new double[length];
        Arrays.fill(values, value);
        return values;
    }
}
