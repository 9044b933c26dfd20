package com.phillippitts.voicegraph.service.audio;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.exception.UnsupportedConversionException;

import java.util.Objects;

/**
 * Linear conversion between 16-bit integer PCM and 32-bit float samples.
 *
 * <p>Integer to float divides by 32768; float to integer multiplies by 32767 and truncates.
 * Both directions clamp. Sample rate and channel count must match; resampling and channel
 * remixing are not supported.
 *
 * @since 1.0
 */
public final class AudioConverter {

    private AudioConverter() {
        // Utility class
    }

    /**
     * Converts {@code buffer} to {@code target}.
     *
     * @return a new buffer in the target format; a copy if the formats are already equal
     * @throws UnsupportedConversionException for any pairing other than int16 and float32
     *         at the same sample rate and channel count
     */
    public static AudioBuffer convert(AudioBuffer buffer, AudioFormat target) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(target, "target");
        AudioFormat source = buffer.format();
        if (source.equals(target)) {
            return buffer.copy();
        }
        if (!canConvert(source, target)) {
            throw new UnsupportedConversionException(source, target);
        }

        AudioBuffer converted = source.isPcm16()
                ? new AudioBuffer(int16ToFloat32(buffer.rawData()), target)
                : new AudioBuffer(float32ToInt16(buffer.rawData()), target);
        converted.metadata().putAll(buffer.metadata());
        return converted;
    }

    public static boolean canConvert(AudioFormat source, AudioFormat target) {
        if (source.equals(target)) {
            return true;
        }
        if (source.sampleRate() != target.sampleRate() || source.channels() != target.channels()) {
            return false;
        }
        return (source.isPcm16() && target.isFloat32()) || (source.isFloat32() && target.isPcm16());
    }

    static byte[] int16ToFloat32(byte[] pcm) {
        int samples = pcm.length / 2;
        byte[] out = new byte[samples * 4];
        for (int i = 0; i < samples; i++) {
            float value = PcmSamples.readInt16(pcm, i * 2) / PcmSamples.INT16_FULL_SCALE;
            PcmSamples.writeFloat32(out, i * 4, PcmSamples.clampUnit(value));
        }
        return out;
    }

    static byte[] float32ToInt16(byte[] floats) {
        int samples = floats.length / 4;
        byte[] out = new byte[samples * 2];
        for (int i = 0; i < samples; i++) {
            double value = PcmSamples.readFloat32(floats, i * 4) * (double) PcmSamples.INT16_MAX;
            PcmSamples.writeInt16(out, i * 2, PcmSamples.clampInt16(value));
        }
        return out;
    }
}
