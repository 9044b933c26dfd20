package com.phillippitts.voicegraph.service.node.websocket;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.event.NodeProcessingEvent;
import com.phillippitts.voicegraph.service.event.TranscriptionReceivedEvent;
import com.phillippitts.voicegraph.service.node.NodeConnection;
import com.phillippitts.voicegraph.service.node.text.TextProcessingNode;
import com.phillippitts.voicegraph.testutil.DaemonThreadExecutor;
import com.phillippitts.voicegraph.testutil.EventCapturingPublisher;
import com.phillippitts.voicegraph.testutil.FakeWebSocketTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class WebSocketTranscriptionNodeTest {

    private FakeWebSocketTransport transport;
    private EventCapturingPublisher publisher;
    private WebSocketTranscriptionNode node;
    private TextProcessingNode downstream;

    @BeforeEach
    void setUp() {
        transport = new FakeWebSocketTransport();
        publisher = new EventCapturingPublisher();
        node = new WebSocketTranscriptionNode("stt", "Speech to text",
                URI.create("wss://stt.example/listen"), () -> transport, new DaemonThreadExecutor("ws-receive-stt"));
        node.setReceivePollTimeout(Duration.ofMillis(20));
        node.attach("p", publisher);

        downstream = new TextProcessingNode("reply", "Reply");
        NodeConnection connection = new NodeConnection("c-text", node, downstream);
        connection.setKind(NodeConnection.KIND_TEXT);
        node.addOutputConnection(connection);
        downstream.addInputConnection(connection);
    }

    @AfterEach
    void tearDown() {
        node.shutdown();
    }

    @Test
    void audioIsDroppedWhileNotStreaming() {
        ProcessingContext context = new ProcessingContext();

        boolean accepted = node.acceptAudio(new AudioBuffer(new byte[320], AudioFormat.DEFAULT), context);

        assertThat(accepted).isFalse();
        assertThat(transport.sent).isEmpty();
        assertThat(context.getLog()).singleElement()
                .satisfies(entry -> assertThat(entry.message()).contains("not streaming"));
    }

    @Test
    void audioIsSentInBoundedBinaryChunks() {
        node.startStreaming();

        boolean accepted = node.acceptAudio(new AudioBuffer(new byte[20_000], AudioFormat.DEFAULT),
                new ProcessingContext());

        assertThat(accepted).isTrue();
        assertThat(transport.sentOfType(WebSocketMessageType.BINARY))
                .extracting(frame -> frame.data().length)
                .containsExactly(8192, 8192, 3616);
        assertThat(publisher.ofType(NodeProcessingEvent.class)).hasSize(1);
    }

    @Test
    void configuredChunkSizeApplies() {
        node.setMaxChunkSize(100);
        node.startStreaming();

        node.acceptAudio(new AudioBuffer(new byte[250], AudioFormat.DEFAULT), new ProcessingContext());

        assertThat(transport.sent).hasSize(3);
    }

    @Test
    void unsupportedFormatIsRejected() {
        node.startStreaming();

        boolean accepted = node.acceptAudio(new AudioBuffer(new byte[4], AudioFormat.CD), new ProcessingContext());

        assertThat(accepted).isFalse();
        assertThat(transport.sent).isEmpty();
    }

    @Test
    void finalTranscriptIsForwardedAsText() {
        node.startStreaming();

        transport.enqueueText("{\"text\": \"hello there\", \"is_final\": true}");

        await().atMost(2, TimeUnit.SECONDS).until(() -> downstream.getLastOutput() != null);
        assertThat(downstream.getLastOutput()).isEqualTo("hello there");
        assertThat(node.getLastTranscript()).isEqualTo("hello there");
        assertThat(publisher.ofType(TranscriptionReceivedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.isFinal()).isTrue());
    }

    @Test
    void interimTranscriptIsPublishedButNotForwarded() {
        node.startStreaming();

        transport.enqueueText("{\"text\": \"hel\", \"is_final\": false}");
        transport.enqueueText("{\"text\": \"hello\", \"is_final\": true}");

        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> publisher.ofType(TranscriptionReceivedEvent.class).size() == 2);
        await().atMost(2, TimeUnit.SECONDS).until(() -> downstream.getLastOutput() != null);
        assertThat(downstream.getStatus().getProcessingCount()).isEqualTo(1);
        assertThat(downstream.getLastOutput()).isEqualTo("hello");
    }

    @Test
    void interimTranscriptsAreForwardedWhenEnabled() {
        node.setForwardInterimResults(true);
        node.startStreaming();

        transport.enqueueText("{\"text\": \"hel\", \"is_final\": false}");

        await().atMost(2, TimeUnit.SECONDS).until(() -> downstream.getLastOutput() != null);
        assertThat(downstream.getLastOutput()).isEqualTo("hel");
    }

    @Test
    void fragmentedMessageIsAssembledBeforeParsing() {
        node.startStreaming();

        transport.enqueueText("{\"text\": \"split ", false);
        transport.enqueueText("message\", \"is_final\": true}", true);

        await().atMost(2, TimeUnit.SECONDS).until(() -> node.getLastTranscript() != null);
        assertThat(node.getLastTranscript()).isEqualTo("split message");
    }

    @Test
    void nonTranscriptMessagesAreIgnored() {
        node.startStreaming();

        transport.enqueueText("{\"type\": \"keepalive\"}");
        transport.enqueueText("not json");
        transport.enqueueText("{\"text\": \"done\", \"is_final\": true}");

        await().atMost(2, TimeUnit.SECONDS).until(() -> node.getLastTranscript() != null);
        assertThat(publisher.ofType(TranscriptionReceivedEvent.class))
                .extracting(TranscriptionReceivedEvent::text)
                .containsExactly("done");
    }

    @Test
    void resetClearsLastTranscript() {
        node.startStreaming();
        transport.enqueueText("{\"text\": \"hi\", \"is_final\": true}");
        await().atMost(2, TimeUnit.SECONDS).until(() -> node.getLastTranscript() != null);

        node.reset();

        assertThat(node.getLastTranscript()).isNull();
    }
}
