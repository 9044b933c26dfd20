package com.phillippitts.voicegraph.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioBufferTest {

    @Test
    void shouldNotShareStorageWithCaller() {
        byte[] data = {1, 2, 3, 4};
        AudioBuffer buffer = new AudioBuffer(data, AudioFormat.DEFAULT);

        data[0] = 99;
        buffer.rawData()[1] = 99;

        assertThat(buffer.rawData()).containsExactly(1, 2, 3, 4);
    }

    @Test
    void durationFollowsFormat() {
        AudioBuffer oneSecond = new AudioBuffer(new byte[32_000], AudioFormat.DEFAULT);
        assertThat(oneSecond.durationSeconds()).isEqualTo(1.0);
    }

    @Test
    void copyKeepsMetadataButNotIdentity() {
        AudioBuffer buffer = new AudioBuffer(new byte[]{1, 2}, AudioFormat.DEFAULT);
        buffer.metadata().put("source", "mic");

        AudioBuffer copy = buffer.copy();
        copy.metadata().put("extra", true);

        assertThat(copy).isNotSameAs(buffer);
        assertThat(copy.contentEquals(buffer)).isTrue();
        assertThat(copy.metadata()).containsEntry("source", "mic");
        assertThat(buffer.metadata()).doesNotContainKey("extra");
    }

    @Test
    void segmentRecordsOriginalPosition() {
        AudioBuffer buffer = new AudioBuffer(new byte[]{0, 1, 2, 3, 4, 5}, AudioFormat.DEFAULT);

        AudioBuffer segment = buffer.segment(2, 2);

        assertThat(segment.rawData()).containsExactly(2, 3);
        assertThat(segment.metadata())
                .containsEntry(AudioBuffer.META_ORIGINAL_OFFSET, 2)
                .containsEntry(AudioBuffer.META_ORIGINAL_LENGTH, 6);
    }

    @Test
    void segmentOutsideBufferFails() {
        AudioBuffer buffer = new AudioBuffer(new byte[4], AudioFormat.DEFAULT);

        assertThatThrownBy(() -> buffer.segment(4, 1)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> buffer.segment(2, 3)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> buffer.segment(0, 0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void contentEqualsComparesFormatAndBytes() {
        AudioBuffer a = new AudioBuffer(new byte[]{1, 2}, AudioFormat.DEFAULT);
        AudioBuffer b = new AudioBuffer(new byte[]{1, 2}, AudioFormat.CD);

        assertThat(a.contentEquals(b)).isFalse();
        assertThat(a.contentEquals(null)).isFalse();
    }
}
