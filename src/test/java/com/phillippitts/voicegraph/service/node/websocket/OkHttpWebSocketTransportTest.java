package com.phillippitts.voicegraph.service.node.websocket;

import com.phillippitts.voicegraph.exception.TransportException;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.ByteString;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class OkHttpWebSocketTransportTest {

    private static final Duration RECEIVE_TIMEOUT = Duration.ofSeconds(2);

    private MockWebServer server;
    private OkHttpClient client;
    private ServerSide serverSide;
    private OkHttpWebSocketTransport transport;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new OkHttpClient();
        serverSide = new ServerSide();
        transport = new OkHttpWebSocketTransport(client, Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() throws IOException {
        transport.release();
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
        server.shutdown();
    }

    @Test
    void connectOpensSocket() {
        connect();

        assertThat(transport.getState()).isEqualTo(WebSocketState.OPEN);
    }

    @Test
    void transportCannotBeReused() {
        connect();

        assertThatThrownBy(() -> transport.connect(endpoint()))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("already used");
    }

    @Test
    void failedHandshakeThrowsAndCloses() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> transport.connect(endpoint()))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("Failed to connect");
        assertThat(transport.getState()).isEqualTo(WebSocketState.CLOSED);
    }

    @Test
    void receiveReturnsNullWhenNothingArrives() {
        connect();

        assertThat(transport.receive(new byte[16], Duration.ofMillis(50))).isNull();
    }

    @Test
    void largeFrameIsReturnedInParts() {
        connect();
        serverSide.socket().send("0123456789");

        byte[] buffer = new byte[4];
        WebSocketReceiveResult first = transport.receive(buffer, RECEIVE_TIMEOUT);
        String firstPart = new String(buffer, 0, first.count(), StandardCharsets.UTF_8);
        WebSocketReceiveResult second = transport.receive(buffer, RECEIVE_TIMEOUT);
        WebSocketReceiveResult third = transport.receive(buffer, RECEIVE_TIMEOUT);
        String lastPart = new String(buffer, 0, third.count(), StandardCharsets.UTF_8);

        assertThat(first.messageType()).isEqualTo(WebSocketMessageType.TEXT);
        assertThat(firstPart).isEqualTo("0123");
        assertThat(first.endOfMessage()).isFalse();
        assertThat(second.count()).isEqualTo(4);
        assertThat(second.endOfMessage()).isFalse();
        assertThat(lastPart).isEqualTo("89");
        assertThat(third.endOfMessage()).isTrue();
    }

    @Test
    void binaryFrameIsReceivedAsBinary() {
        connect();
        serverSide.socket().send(ByteString.of((byte) 1, (byte) 2, (byte) 3));

        byte[] buffer = new byte[16];
        WebSocketReceiveResult result = transport.receive(buffer, RECEIVE_TIMEOUT);

        assertThat(result.messageType()).isEqualTo(WebSocketMessageType.BINARY);
        assertThat(result.count()).isEqualTo(3);
        assertThat(result.endOfMessage()).isTrue();
        assertThat(buffer[2]).isEqualTo((byte) 3);
    }

    @Test
    void partialSendsAreJoinedIntoOneMessage() throws InterruptedException {
        connect();

        transport.send("hel".getBytes(StandardCharsets.UTF_8), WebSocketMessageType.TEXT, false);
        transport.send("lo".getBytes(StandardCharsets.UTF_8), WebSocketMessageType.TEXT, true);
        transport.send(new byte[]{9, 8}, WebSocketMessageType.BINARY, true);

        assertThat(serverSide.messages.poll(2, TimeUnit.SECONDS)).isEqualTo("hello");
        assertThat(serverSide.messages.poll(2, TimeUnit.SECONDS)).isEqualTo("bytes:0908");
    }

    @Test
    void sendRequiresOpenSocket() {
        assertThatThrownBy(() -> transport.send(new byte[1], WebSocketMessageType.BINARY, true))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("not open");
    }

    @Test
    void closeFramesMustGoThroughClose() {
        connect();

        assertThatThrownBy(() -> transport.send(new byte[0], WebSocketMessageType.CLOSE, true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void localCloseCompletesHandshake() {
        connect();

        transport.close(WebSocketTransport.NORMAL_CLOSURE, "done");

        assertThat(transport.getState()).isIn(WebSocketState.CLOSE_SENT, WebSocketState.CLOSED);
        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.getState() == WebSocketState.CLOSED);
    }

    @Test
    void peerCloseIsReportedThenAnswered() {
        connect();
        serverSide.socket().close(1000, "bye");

        WebSocketReceiveResult result = transport.receive(new byte[8], RECEIVE_TIMEOUT);

        assertThat(result.messageType()).isEqualTo(WebSocketMessageType.CLOSE);
        assertThat(transport.getState()).isEqualTo(WebSocketState.CLOSE_RECEIVED);

        transport.close(WebSocketTransport.NORMAL_CLOSURE, "bye");

        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.getState() == WebSocketState.CLOSED);
    }

    private void connect() {
        server.enqueue(new MockResponse().withWebSocketUpgrade(serverSide));
        transport.connect(endpoint());
    }

    private URI endpoint() {
        return URI.create(server.url("/ws").toString().replaceFirst("^http", "ws"));
    }

    private static final class ServerSide extends WebSocketListener {

        final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final BlockingQueue<WebSocket> opened = new LinkedBlockingQueue<>();
        private WebSocket socket;

        WebSocket socket() {
            if (socket == null) {
                try {
                    socket = opened.poll(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
            assertThat(socket).as("server-side socket").isNotNull();
            return socket;
        }

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            opened.offer(webSocket);
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            messages.offer(text);
        }

        @Override
        public void onMessage(WebSocket webSocket, ByteString bytes) {
            messages.offer("bytes:" + bytes.hex());
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(code, null);
        }
    }
}
