package com.phillippitts.voicegraph.service.node.processor;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import org.junit.jupiter.api.Test;

import static com.phillippitts.voicegraph.testutil.AudioFixtures.pcm16;
import static org.assertj.core.api.Assertions.assertThat;

class FormatConversionNodeTest {

    private static final AudioFormat FLOAT_MONO = AudioFormat.float32(16_000, 1);

    @Test
    void outputFormatIsPinnedToTarget() {
        FormatConversionNode node = new FormatConversionNode("conv", "Convert", FLOAT_MONO);

        assertThat(node.getOutputFormat()).isEqualTo(FLOAT_MONO);
    }

    @Test
    void convertsSupportedPairing() {
        FormatConversionNode node = new FormatConversionNode("conv", "Convert", FLOAT_MONO);

        node.acceptAudio(pcm16(AudioFormat.DEFAULT, 1, 2), new ProcessingContext());

        assertThat(node.pullAudioOutput(null).format()).isEqualTo(FLOAT_MONO);
        assertThat(node.pullAudioOutput(null).length()).isEqualTo(8);
    }

    @Test
    void unsupportedPairingForwardsInputWithWarning() {
        FormatConversionNode node = new FormatConversionNode("conv", "Convert", AudioFormat.CD);
        AudioBuffer input = pcm16(AudioFormat.DEFAULT, 1, 2);
        ProcessingContext context = new ProcessingContext();

        boolean accepted = node.acceptAudio(input, context);

        assertThat(accepted).isTrue();
        assertThat(node.pullAudioOutput(null)).isSameAs(input);
        assertThat(context.getLog()).singleElement()
                .satisfies(entry -> assertThat(entry.message()).contains("not supported"));
    }
}
