package com.phillippitts.voicegraph.service.node.websocket;

import com.phillippitts.voicegraph.exception.TransportException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link WebSocketTransport} over OkHttp.
 *
 * <p>OkHttp delivers frames on its own reader thread through {@link WebSocketListener}
 * callbacks; they are queued here and handed out by {@link #receive}. A frame larger than
 * the caller's buffer is returned in several parts, the last one flagged end-of-message.
 *
 * <p><b>Thread Safety:</b> state transitions are atomic. {@link #receive} is meant for a
 * single consumer thread; {@link #send} is serialized internally.
 *
 * @since 1.0
 */
public class OkHttpWebSocketTransport implements WebSocketTransport {

    private static final Logger LOG = LogManager.getLogger(OkHttpWebSocketTransport.class);

    private final OkHttpClient client;
    private final Duration connectTimeout;
    private final AtomicReference<WebSocketState> state = new AtomicReference<>(WebSocketState.NONE);
    private final BlockingQueue<Frame> inbound = new LinkedBlockingQueue<>();
    private final CountDownLatch openLatch = new CountDownLatch(1);
    private final Object sendLock = new Object();
    private final ByteArrayOutputStream partialSend = new ByteArrayOutputStream();

    private volatile WebSocket webSocket;
    private volatile Throwable failure;
    private Frame current;
    private int currentOffset;

    public OkHttpWebSocketTransport(OkHttpClient client, Duration connectTimeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    @Override
    public WebSocketState getState() {
        return state.get();
    }

    @Override
    public void connect(URI endpoint) {
        if (!state.compareAndSet(WebSocketState.NONE, WebSocketState.CONNECTING)) {
            throw new TransportException("Transport already used (state " + state.get() + ")");
        }
        Request request = new Request.Builder().url(endpoint.toString()).build();
        webSocket = client.newWebSocket(request, new Listener());
        try {
            if (!openLatch.await(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                webSocket.cancel();
                state.set(WebSocketState.CLOSED);
                throw new TransportException("Timed out connecting to " + endpoint + " after " + connectTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            webSocket.cancel();
            state.set(WebSocketState.CLOSED);
            throw new TransportException("Interrupted while connecting to " + endpoint, e);
        }
        if (failure != null) {
            throw new TransportException("Failed to connect to " + endpoint + ": " + failure.getMessage(), failure);
        }
        LOG.debug("WebSocket connected to {}", endpoint);
    }

    @Override
    public void send(byte[] data, WebSocketMessageType messageType, boolean endOfMessage) {
        if (messageType == WebSocketMessageType.CLOSE) {
            throw new IllegalArgumentException("Use close() to send a close frame");
        }
        synchronized (sendLock) {
            if (state.get() != WebSocketState.OPEN) {
                throw new TransportException("WebSocket is not open (state " + state.get() + ")");
            }
            partialSend.write(data, 0, data.length);
            if (!endOfMessage) {
                return;
            }
            byte[] message = partialSend.toByteArray();
            partialSend.reset();
            boolean queued = messageType == WebSocketMessageType.TEXT
                    ? webSocket.send(new String(message, StandardCharsets.UTF_8))
                    : webSocket.send(ByteString.of(message));
            if (!queued) {
                throw new TransportException("WebSocket rejected outbound " + messageType + " frame");
            }
        }
    }

    @Override
    public WebSocketReceiveResult receive(byte[] buffer, Duration timeout) {
        if (current == null) {
            try {
                current = inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
            currentOffset = 0;
            if (current == null) {
                return null;
            }
        }
        Frame frame = current;
        if (frame.error() != null) {
            current = null;
            throw new TransportException("WebSocket failed: " + frame.error().getMessage(), frame.error());
        }
        if (frame.type() == WebSocketMessageType.CLOSE) {
            current = null;
            return WebSocketReceiveResult.close();
        }
        int remaining = frame.data().length - currentOffset;
        int count = Math.min(remaining, buffer.length);
        System.arraycopy(frame.data(), currentOffset, buffer, 0, count);
        currentOffset += count;
        boolean end = currentOffset >= frame.data().length;
        if (end) {
            current = null;
        }
        return new WebSocketReceiveResult(count, frame.type(), end);
    }

    @Override
    public void close(int statusCode, String reason) {
        WebSocket socket = webSocket;
        if (socket == null) {
            return;
        }
        if (state.compareAndSet(WebSocketState.OPEN, WebSocketState.CLOSE_SENT)) {
            socket.close(statusCode, reason);
        } else if (state.compareAndSet(WebSocketState.CLOSE_RECEIVED, WebSocketState.CLOSED)) {
            socket.close(statusCode, reason);
        }
    }

    @Override
    public void release() {
        WebSocket socket = webSocket;
        if (socket != null && state.getAndSet(WebSocketState.CLOSED) != WebSocketState.CLOSED) {
            socket.cancel();
        }
        openLatch.countDown();
    }

    private final class Listener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket ws, Response response) {
            state.compareAndSet(WebSocketState.CONNECTING, WebSocketState.OPEN);
            openLatch.countDown();
        }

        @Override
        public void onMessage(WebSocket ws, String text) {
            inbound.offer(new Frame(WebSocketMessageType.TEXT, text.getBytes(StandardCharsets.UTF_8), null));
        }

        @Override
        public void onMessage(WebSocket ws, ByteString bytes) {
            inbound.offer(new Frame(WebSocketMessageType.BINARY, bytes.toByteArray(), null));
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            state.compareAndSet(WebSocketState.OPEN, WebSocketState.CLOSE_RECEIVED);
            inbound.offer(new Frame(WebSocketMessageType.CLOSE, new byte[0], null));
        }

        @Override
        public void onClosed(WebSocket ws, int code, String reason) {
            state.set(WebSocketState.CLOSED);
        }

        @Override
        public void onFailure(WebSocket ws, Throwable t, Response response) {
            failure = t;
            WebSocketState previous = state.getAndSet(WebSocketState.CLOSED);
            openLatch.countDown();
            if (previous != WebSocketState.CONNECTING) {
                inbound.offer(new Frame(null, new byte[0], t));
            }
            LOG.debug("WebSocket failure in state {}: {}", previous, t.getMessage());
        }
    }

    private record Frame(WebSocketMessageType type, byte[] data, Throwable error) {
    }
}
