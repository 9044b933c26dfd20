package com.phillippitts.voicegraph.domain;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Raw PCM bytes paired with their {@link AudioFormat} and a string-keyed metadata map.
 *
 * <p>The buffer owns a private copy of its bytes and {@link #rawData()} returns a copy, so
 * a buffer handed to a connection cannot be changed by the receiver. Only the metadata
 * map is mutable; use {@link #copy()} before annotating a buffer that other nodes hold.
 */
public final class AudioBuffer {

    /** Metadata key recording the byte offset of a segment within its parent buffer. */
    public static final String META_ORIGINAL_OFFSET = "originalOffset";
    /** Metadata key recording the byte length of the parent buffer of a segment. */
    public static final String META_ORIGINAL_LENGTH = "originalLength";

    private final byte[] data;
    private final AudioFormat format;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public AudioBuffer(byte[] data, AudioFormat format) {
        Objects.requireNonNull(data, "data");
        this.format = Objects.requireNonNull(format, "format");
        this.data = data.clone();
    }

    /**
     * Returns a copy of the raw bytes.
     */
    public byte[] rawData() {
        return data.clone();
    }

    /**
     * Number of raw bytes in the buffer.
     */
    public int length() {
        return data.length;
    }

    /**
     * Reads one byte without copying the whole buffer. Used by the sample-level engines.
     */
    public byte byteAt(int index) {
        return data[index];
    }

    public AudioFormat format() {
        return format;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public double durationSeconds() {
        return data.length / (double) format.bytesPerSecond();
    }

    /**
     * Deep copy: new byte storage, same format, metadata entries preserved.
     */
    public AudioBuffer copy() {
        AudioBuffer copy = new AudioBuffer(data, format);
        copy.metadata.putAll(metadata);
        return copy;
    }

    /**
     * Returns a sub-buffer of {@code length} bytes starting at {@code offset}.
     *
     * @throws IndexOutOfBoundsException if {@code offset} is outside {@code [0, length())},
     *         {@code length} is not positive, or the segment runs past the end
     */
    public AudioBuffer segment(int offset, int length) {
        if (offset < 0 || offset >= data.length) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside [0, " + data.length + ")");
        }
        if (length <= 0 || offset + length > data.length) {
            throw new IndexOutOfBoundsException("length " + length + " invalid at offset " + offset
                    + " for buffer of " + data.length + " bytes");
        }
        AudioBuffer segment = new AudioBuffer(Arrays.copyOfRange(data, offset, offset + length), format);
        segment.metadata.putAll(metadata);
        segment.metadata.put(META_ORIGINAL_OFFSET, offset);
        segment.metadata.put(META_ORIGINAL_LENGTH, data.length);
        return segment;
    }

    /**
     * Content equality: same format and same bytes. Metadata is not compared.
     */
    public boolean contentEquals(AudioBuffer other) {
        return other != null && format.equals(other.format) && Arrays.equals(data, other.data);
    }

    @Override
    public String toString() {
        return "AudioBuffer[" + data.length + " bytes, " + format + ", "
                + String.format("%.2fs", durationSeconds()) + "]";
    }
}
