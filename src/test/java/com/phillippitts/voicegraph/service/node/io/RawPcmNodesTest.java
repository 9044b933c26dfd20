package com.phillippitts.voicegraph.service.node.io;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.node.NodeConnection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RawPcmNodesTest {

    @Test
    void inputQueuesAndForwardsAudio() {
        RawPcmInputNode input = new RawPcmInputNode("in", "Input");
        RawPcmOutputNode output = new RawPcmOutputNode("out", "Output");
        NodeConnection connection = new NodeConnection("c1", input, output);
        input.addOutputConnection(connection);
        output.addInputConnection(connection);

        boolean accepted = input.pushAudio(new byte[]{1, 2}, AudioFormat.DEFAULT, new ProcessingContext());

        assertThat(accepted).isTrue();
        assertThat(input.hasQueuedAudio()).isTrue();
        assertThat(input.nextQueuedAudio().rawData()).containsExactly(1, 2);
        assertThat(input.nextQueuedAudio()).isNull();
        assertThat(output.pullAudioOutput(null).rawData()).containsExactly(1, 2);
    }

    @Test
    void inputRejectsUnsupportedFormat() {
        RawPcmInputNode input = new RawPcmInputNode("in", "Input");
        input.setSupportedFormats(List.of(AudioFormat.CD));

        assertThat(input.pushAudio(new byte[2], AudioFormat.DEFAULT, new ProcessingContext())).isFalse();
        assertThat(input.hasQueuedAudio()).isFalse();
    }

    @Test
    void disabledInputAcceptsNothing() {
        RawPcmInputNode input = new RawPcmInputNode("in", "Input");
        input.setEnabled(false);

        assertThat(input.pushAudio(new byte[2], AudioFormat.DEFAULT, null)).isFalse();
    }

    @Test
    void resetClearsQueue() {
        RawPcmInputNode input = new RawPcmInputNode("in", "Input");
        input.pushAudio(new byte[2], AudioFormat.DEFAULT, null);

        input.reset();

        assertThat(input.hasQueuedAudio()).isFalse();
    }

    @Test
    void outputAdoptsFormatOfLastBuffer() {
        RawPcmOutputNode output = new RawPcmOutputNode("out", "Output");
        AudioBuffer buffer = new AudioBuffer(new byte[4], AudioFormat.CD);

        output.acceptAudio(buffer, null);

        assertThat(output.getOutputFormat()).isEqualTo(AudioFormat.CD);
        assertThat(output.pullAudioOutput(null)).isSameAs(buffer);

        output.reset();
        assertThat(output.pullAudioOutput(null)).isNull();
    }
}
