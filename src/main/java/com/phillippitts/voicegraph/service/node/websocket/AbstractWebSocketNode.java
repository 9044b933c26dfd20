package com.phillippitts.voicegraph.service.node.websocket;

import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.exception.NotConnectedException;
import com.phillippitts.voicegraph.exception.TransportException;
import com.phillippitts.voicegraph.service.event.ConnectionStateChangedEvent;
import com.phillippitts.voicegraph.service.event.WebSocketMessageReceivedEvent;
import com.phillippitts.voicegraph.service.node.streaming.AbstractStreamingNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Streaming node that talks to a remote service over a WebSocket.
 *
 * <p><b>Connection:</b> {@link #connect()} and {@link #disconnect()} are serialized by a
 * per-node lock. A transport that has left {@link WebSocketState#NONE} is discarded and a
 * fresh one created before a new connect attempt.
 *
 * <p><b>Receive loop:</b> starting the stream connects (if needed) and launches a loop on
 * the receive executor, bound to the streaming cancellation scope. If the executor refuses
 * the loop, the socket opened for it is closed and released and the start fails. Every non-close frame is
 * copied out of the shared receive buffer, published as a
 * {@link WebSocketMessageReceivedEvent} and passed to
 * {@link #onMessageReceived(byte[], WebSocketMessageType, boolean, ProcessingContext)}.
 * A close frame disconnects and ends the loop. Any failure is recorded in the node status,
 * followed by a best-effort disconnect; the loop does not reconnect on its own.
 *
 * <p><b>Shutdown:</b> stops streaming, disconnects, then releases the transport.
 *
 * @since 1.0
 */
public abstract class AbstractWebSocketNode extends AbstractStreamingNode {

    private static final Logger LOG = LogManager.getLogger(AbstractWebSocketNode.class);

    public static final String CONFIG_ENDPOINT = "endpoint";
    public static final int DEFAULT_RECEIVE_BUFFER_SIZE = 32 * 1024;
    public static final Duration DEFAULT_RECEIVE_POLL = Duration.ofMillis(200);

    private final WebSocketTransportFactory transportFactory;
    private final Executor receiveExecutor;
    private final ReentrantLock connectionLock = new ReentrantLock();
    private final Object sendLock = new Object();

    private volatile WebSocketTransport transport;
    private volatile EndpointResolver endpointResolver = EndpointResolver.DIRECT;
    private volatile int receiveBufferSize = DEFAULT_RECEIVE_BUFFER_SIZE;
    private volatile Duration receivePollTimeout = DEFAULT_RECEIVE_POLL;

    /**
     * @param receiveExecutor runs receive loops, normally the {@code streamingExecutor} bean
     */
    protected AbstractWebSocketNode(String id, String name, URI endpoint,
                                    WebSocketTransportFactory transportFactory, Executor receiveExecutor) {
        super(id, name);
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.receiveExecutor = Objects.requireNonNull(receiveExecutor, "receiveExecutor");
        if (endpoint != null) {
            setEndpoint(endpoint);
        }
    }

    public URI getEndpoint() {
        String value = getConfigurationValue(CONFIG_ENDPOINT, String.class, null);
        return value == null ? null : URI.create(value);
    }

    public void setEndpoint(URI endpoint) {
        setConfigurationValue(CONFIG_ENDPOINT, endpoint == null ? null : endpoint.toString());
    }

    public void setEndpointResolver(EndpointResolver endpointResolver) {
        this.endpointResolver = endpointResolver == null ? EndpointResolver.DIRECT : endpointResolver;
    }

    public void setReceiveBufferSize(int receiveBufferSize) {
        if (receiveBufferSize <= 0) {
            throw new IllegalArgumentException("receiveBufferSize must be > 0");
        }
        this.receiveBufferSize = receiveBufferSize;
    }

    public void setReceivePollTimeout(Duration receivePollTimeout) {
        this.receivePollTimeout = Objects.requireNonNull(receivePollTimeout, "receivePollTimeout");
    }

    public WebSocketState getConnectionState() {
        WebSocketTransport current = transport;
        return current == null ? WebSocketState.NONE : current.getState();
    }

    public boolean isConnected() {
        return getConnectionState() == WebSocketState.OPEN;
    }

    @Override
    public boolean validate() {
        return getEndpoint() != null;
    }

    /**
     * Opens the socket if it is not already open.
     *
     * @throws TransportException if no endpoint is configured or the connect fails
     */
    public void connect() {
        connectionLock.lock();
        try {
            WebSocketTransport current = transport;
            if (current != null && current.getState() == WebSocketState.OPEN) {
                return;
            }
            if (current != null && current.getState() != WebSocketState.NONE) {
                current.release();
                current = null;
            }
            if (current == null) {
                current = transportFactory.create();
                transport = current;
            }
            URI endpoint = getEndpoint();
            if (endpoint == null) {
                throw new TransportException("No endpoint configured", getId());
            }

            WebSocketState previous = current.getState();
            try {
                current.connect(endpointResolver.resolve(endpoint));
            } catch (TransportException e) {
                recordTransportError(e);
                throw new TransportException("Failed to connect to " + endpoint, getId(), e);
            }
            getDiagnostics().put("connectedAt", Instant.now());
            publish(new ConnectionStateChangedEvent(getId(), previous, current.getState(), Instant.now()));
            LOG.info("Node '{}' connected to {}", getId(), endpoint);
        } finally {
            connectionLock.unlock();
        }
    }

    /**
     * Performs the close handshake if the socket is open (or answers a peer-initiated close).
     */
    public void disconnect() {
        connectionLock.lock();
        try {
            WebSocketTransport current = transport;
            if (current == null) {
                return;
            }
            WebSocketState previous = current.getState();
            if (previous != WebSocketState.OPEN && previous != WebSocketState.CLOSE_RECEIVED) {
                return;
            }
            current.close(WebSocketTransport.NORMAL_CLOSURE, "Normal closure");
            getDiagnostics().put("disconnectedAt", Instant.now());
            publish(new ConnectionStateChangedEvent(getId(), previous, current.getState(), Instant.now()));
            LOG.info("Node '{}' disconnected", getId());
        } finally {
            connectionLock.unlock();
        }
    }

    /**
     * Sends one frame.
     *
     * @throws NotConnectedException if the socket is not open
     * @throws TransportException if the transport rejects the frame
     */
    public void send(byte[] data, WebSocketMessageType messageType, boolean endOfMessage) {
        WebSocketTransport current = transport;
        if (current == null || current.getState() != WebSocketState.OPEN) {
            throw new NotConnectedException(getId());
        }
        synchronized (sendLock) {
            current.send(data, messageType, endOfMessage);
        }
    }

    public void sendText(String text) {
        send(text.getBytes(StandardCharsets.UTF_8), WebSocketMessageType.TEXT, true);
    }

    @Override
    protected void onStartStreaming(ProcessingContext streamingContext) {
        connect();
        WebSocketTransport current = transport;
        try {
            receiveExecutor.execute(() -> receiveLoop(current, streamingContext));
        } catch (RejectedExecutionException e) {
            LOG.warn("Receive loop for node '{}' was rejected: {}", getId(), e.getMessage());
            getStatus().recordError("Receive loop rejected: " + e.getMessage());
            closeAndRelease();
            throw e;
        }
    }

    private void receiveLoop(WebSocketTransport socket, ProcessingContext context) {
        byte[] buffer = new byte[receiveBufferSize];
        LOG.debug("Receive loop started for node '{}'", getId());
        try {
            while (!context.isCancellationRequested() && isReadable(socket.getState())) {
                WebSocketReceiveResult result = socket.receive(buffer, receivePollTimeout);
                if (result == null) {
                    continue;
                }
                if (result.messageType() == WebSocketMessageType.CLOSE) {
                    LOG.info("Node '{}' received close frame", getId());
                    disconnect();
                    break;
                }
                byte[] data = Arrays.copyOf(buffer, result.count());
                publish(new WebSocketMessageReceivedEvent(getId(), data, result.messageType(),
                        result.endOfMessage(), context, Instant.now()));
                onMessageReceived(data, result.messageType(), result.endOfMessage(), context);
            }
        } catch (RuntimeException e) {
            recordTransportError(e);
            LOG.warn("Receive loop for node '{}' failed: {}", getId(), e.getMessage());
            try {
                disconnect();
            } catch (RuntimeException disconnectError) {
                LOG.debug("Best-effort disconnect of node '{}' failed: {}", getId(), disconnectError.getMessage());
            }
        }
        LOG.debug("Receive loop ended for node '{}'", getId());
    }

    private static boolean isReadable(WebSocketState state) {
        return state == WebSocketState.OPEN || state == WebSocketState.CLOSE_SENT;
    }

    private void recordTransportError(Exception e) {
        getStatus().recordTransportError(e.getMessage());
        getStatus().recordError(e.getMessage());
        getDiagnostics().put("lastWebSocketError", String.valueOf(e.getMessage()));
        getDiagnostics().put("lastWebSocketErrorAt", Instant.now());
    }

    /**
     * Stops streaming, disconnects and releases the transport, whether or not the node was
     * initialized.
     */
    @Override
    public void shutdown() {
        super.shutdown();
        closeAndRelease();
    }

    private void closeAndRelease() {
        try {
            disconnect();
        } catch (RuntimeException e) {
            LOG.warn("Disconnect of node '{}' failed: {}", getId(), e.getMessage());
        }
        connectionLock.lock();
        try {
            WebSocketTransport current = transport;
            if (current != null) {
                current.release();
            }
            transport = null;
        } finally {
            connectionLock.unlock();
        }
    }

    /**
     * Node-specific interpretation of one inbound frame. Runs on the receive loop thread.
     *
     * @param data private copy of the frame bytes
     * @param endOfMessage {@code false} if more parts of the same message follow
     * @param context the streaming context
     */
    protected abstract void onMessageReceived(byte[] data, WebSocketMessageType messageType,
                                              boolean endOfMessage, ProcessingContext context);
}
