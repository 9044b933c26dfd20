package com.phillippitts.voicegraph.service.audio;

/**
 * Little-endian sample codecs for the two sample representations the engine operates on:
 * signed 16-bit integer PCM and 32-bit IEEE float.
 *
 * @since 1.0
 */
public final class PcmSamples {

    /** Full-scale divisor for int16 to float conversion. */
    public static final float INT16_FULL_SCALE = 32768f;

    /** Multiplier for float to int16 conversion. */
    public static final float INT16_MAX = 32767f;

    private PcmSamples() {
        // Utility class
    }

    public static short readInt16(byte[] data, int offset) {
        return (short) ((data[offset] & 0xFF) | (data[offset + 1] << 8));
    }

    public static void writeInt16(byte[] data, int offset, int value) {
        data[offset] = (byte) value;
        data[offset + 1] = (byte) (value >> 8);
    }

    public static float readFloat32(byte[] data, int offset) {
        int bits = (data[offset] & 0xFF)
                | (data[offset + 1] & 0xFF) << 8
                | (data[offset + 2] & 0xFF) << 16
                | (data[offset + 3] & 0xFF) << 24;
        return Float.intBitsToFloat(bits);
    }

    public static void writeFloat32(byte[] data, int offset, float value) {
        int bits = Float.floatToIntBits(value);
        data[offset] = (byte) bits;
        data[offset + 1] = (byte) (bits >> 8);
        data[offset + 2] = (byte) (bits >> 16);
        data[offset + 3] = (byte) (bits >> 24);
    }

    public static int clampInt16(double value) {
        if (value > Short.MAX_VALUE) {
            return Short.MAX_VALUE;
        }
        if (value < Short.MIN_VALUE) {
            return Short.MIN_VALUE;
        }
        return (int) value;
    }

    public static float clampUnit(double value) {
        if (value > 1.0) {
            return 1.0f;
        }
        if (value < -1.0) {
            return -1.0f;
        }
        return (float) value;
    }
}
