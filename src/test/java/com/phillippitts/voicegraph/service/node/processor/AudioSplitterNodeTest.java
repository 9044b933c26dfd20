package com.phillippitts.voicegraph.service.node.processor;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.audio.PcmSamples;
import com.phillippitts.voicegraph.service.node.NodeConnection;
import com.phillippitts.voicegraph.service.node.io.RawPcmOutputNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.phillippitts.voicegraph.testutil.AudioFixtures.pcm16;
import static com.phillippitts.voicegraph.testutil.AudioFixtures.samplesOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioSplitterNodeTest {

    private AudioSplitterNode splitter;
    private RawPcmOutputNode voiceOut;
    private RawPcmOutputNode musicOut;
    private RawPcmOutputNode mainOut;

    @BeforeEach
    void setUp() {
        splitter = new AudioSplitterNode("split", "Splitter");
        splitter.addChannel("voice", AudioSplitterNodeTest::doubled);
        splitter.addChannel("music", (buffer, ctx) -> buffer);
        voiceOut = new RawPcmOutputNode("voiceOut", "Voice");
        musicOut = new RawPcmOutputNode("musicOut", "Music");
        mainOut = new RawPcmOutputNode("mainOut", "Main");
        connect("c-voice", voiceOut).setConfigurationValue(NodeConnection.CONFIG_CHANNEL_ID, "voice");
        connect("c-music", musicOut).setConfigurationValue(NodeConnection.CONFIG_CHANNEL_ID, "music");
        connect("c-main", mainOut);
    }

    private NodeConnection connect(String id, RawPcmOutputNode target) {
        NodeConnection connection = new NodeConnection(id, splitter, target);
        splitter.addOutputConnection(connection);
        target.addInputConnection(connection);
        return connection;
    }

    private static AudioBuffer doubled(AudioBuffer buffer, ProcessingContext context) {
        byte[] data = buffer.rawData();
        for (int i = 0; i + 1 < data.length; i += 2) {
            PcmSamples.writeInt16(data, i, PcmSamples.readInt16(data, i) * 2);
        }
        return new AudioBuffer(data, buffer.format());
    }

    @Test
    void channelsReceiveTheirOwnTransformWhileOutputIsTheOriginal() {
        AudioBuffer input = pcm16(AudioFormat.DEFAULT, 100, -50);
        ProcessingContext context = new ProcessingContext();

        splitter.acceptAudio(input, context);

        assertThat(samplesOf(voiceOut.pullAudioOutput(null))).containsExactly(200, -100);
        assertThat(samplesOf(musicOut.pullAudioOutput(null))).containsExactly(100, -50);
        assertThat(voiceOut.pullAudioOutput(null)).isNotSameAs(musicOut.pullAudioOutput(null));
        assertThat(splitter.pullAudioOutput(null)).isSameAs(input);
        assertThat(mainOut.pullAudioOutput(null)).isSameAs(input);
        assertThat(context.hasTransientData(AudioSplitterNode.channelResultKey("split", "voice"))).isTrue();
    }

    @Test
    void disabledChannelSendsNothing() {
        splitter.setChannelEnabled("voice", false);

        splitter.acceptAudio(pcm16(AudioFormat.DEFAULT, 1, 2), new ProcessingContext());

        assertThat(voiceOut.pullAudioOutput(null)).isNull();
        assertThat(musicOut.pullAudioOutput(null)).isNotNull();
    }

    @Test
    void resetReenablesChannels() {
        splitter.setChannelEnabled("voice", false);

        splitter.reset();

        assertThat(splitter.getChannels()).allSatisfy(channel -> assertThat(channel.enabled()).isTrue());
        assertThat(splitter.getChannels()).hasSize(2);
    }

    @Test
    void channelManagementRejectsDuplicatesAndUnknownIds() {
        assertThatThrownBy(() -> splitter.addChannel("voice", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> splitter.setChannelEnabled("drums", true)).isInstanceOf(IllegalArgumentException.class);
        assertThat(splitter.removeChannel("music")).isTrue();
        assertThat(splitter.removeChannel("music")).isFalse();
    }
}
