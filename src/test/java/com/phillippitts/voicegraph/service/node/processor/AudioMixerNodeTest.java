package com.phillippitts.voicegraph.service.node.processor;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static com.phillippitts.voicegraph.testutil.AudioFixtures.constantPcm16;
import static com.phillippitts.voicegraph.testutil.AudioFixtures.pcm16;
import static com.phillippitts.voicegraph.testutil.AudioFixtures.samplesOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioMixerNodeTest {

    private MutableClock clock;
    private AudioMixerNode mixer;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        mixer = new AudioMixerNode("mix", "Mixer", clock);
        mixer.setMaxBufferAgeMs(1000);
    }

    private void feed(String sourceId, AudioBuffer buffer) {
        ProcessingContext context = new ProcessingContext();
        context.setTransientData(AudioMixerNode.SOURCE_ID_KEY, sourceId);
        mixer.acceptAudio(buffer, context);
    }

    @Test
    void singleSourcePassesThrough() {
        AudioBuffer buffer = constantPcm16(4, 500);

        feed("a", buffer);

        assertThat(mixer.pullAudioOutput(null)).isSameAs(buffer);
        assertThat(mixer.getBufferedSourceCount()).isEqualTo(1);
    }

    @Test
    void twoSourcesAreMixedWithNormalization() {
        feed("a", constantPcm16(4, 1000));
        feed("b", constantPcm16(4, 3000));

        assertThat(samplesOf(mixer.pullAudioOutput(null))).containsOnly(2000);
    }

    @Test
    void twoSourcesAreSummedWithoutNormalization() {
        mixer.setNormalize(false);

        feed("a", constantPcm16(4, 1000));
        feed("b", constantPcm16(4, 3000));

        assertThat(samplesOf(mixer.pullAudioOutput(null))).containsOnly(4000);
    }

    @Test
    void sameSourceReplacesItsPreviousBuffer() {
        feed("a", constantPcm16(4, 1000));
        feed("a", constantPcm16(4, 3000));

        assertThat(mixer.getBufferedSourceCount()).isEqualTo(1);
        assertThat(samplesOf(mixer.pullAudioOutput(null))).containsOnly(3000);
    }

    @Test
    void bufferOlderThanMaxAgeIsEvicted() {
        feed("a", constantPcm16(4, 1000));
        clock.advance(Duration.ofMillis(1001));

        feed("b", constantPcm16(4, 3000));

        assertThat(mixer.getBufferedSourceCount()).isEqualTo(1);
        assertThat(samplesOf(mixer.pullAudioOutput(null))).containsOnly(3000);
    }

    @Test
    void bufferExactlyAtMaxAgeStillMixes() {
        feed("a", constantPcm16(4, 1000));
        clock.advance(Duration.ofMillis(1000));

        feed("b", constantPcm16(4, 3000));

        assertThat(samplesOf(mixer.pullAudioOutput(null))).containsOnly(2000);
    }

    @Test
    void buffersWithOtherFormatsAreLeftOut() {
        feed("a", constantPcm16(4, 1000));
        feed("b", pcm16(AudioFormat.CD, 3000, 3000, 3000, 3000));

        assertThat(samplesOf(mixer.pullAudioOutput(null))).containsOnly(1000);
    }

    @Test
    void channelWeightApplies() {
        mixer.setChannelWeight(0, 0.5);

        feed("a", constantPcm16(2, 1000));
        feed("b", constantPcm16(2, 1000));

        assertThat(mixer.getChannelWeight(0)).isEqualTo(0.5);
        assertThat(mixer.getChannelWeight(3)).isEqualTo(1.0);
        assertThat(samplesOf(mixer.pullAudioOutput(null))).containsOnly(500);
    }

    @Test
    void resetDropsBuffersButKeepsWeightsAndSettings() {
        mixer.setChannelWeight(0, 0.25);
        mixer.setNormalize(false);
        feed("a", constantPcm16(2, 1000));

        mixer.reset();

        assertThat(mixer.getBufferedSourceCount()).isZero();
        assertThat(mixer.getChannelWeight(0)).isEqualTo(0.25);
        assertThat(mixer.isNormalize()).isFalse();
        assertThat(mixer.getMaxBufferAgeMs()).isEqualTo(1000);
    }

    @Test
    void maxAgeMustBePositive() {
        assertThatThrownBy(() -> mixer.setMaxBufferAgeMs(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
