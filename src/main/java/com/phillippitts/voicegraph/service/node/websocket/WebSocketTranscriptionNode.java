package com.phillippitts.voicegraph.service.node.websocket;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.event.NodeProcessingEvent;
import com.phillippitts.voicegraph.service.event.TranscriptionReceivedEvent;
import com.phillippitts.voicegraph.service.node.AudioInputCapable;
import com.phillippitts.voicegraph.util.LogSanitizer;
import com.phillippitts.voicegraph.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * Streams PCM to a remote speech-to-text service and turns its JSON replies into text.
 *
 * <p>Accepted audio is sent as binary frames of at most {@code maxChunkSize} bytes while the
 * node is streaming. Inbound text frames are parsed as {@code {"text", "is_final"}};
 * every transcript raises a {@link TranscriptionReceivedEvent}, and final transcripts
 * (interim ones too, if enabled) are forwarded as strings to outbound connections.
 */
public class WebSocketTranscriptionNode extends AbstractWebSocketNode implements AudioInputCapable {

    private static final Logger LOG = LogManager.getLogger(WebSocketTranscriptionNode.class);

    public static final String CONFIG_MAX_CHUNK_SIZE = "maxChunkSize";
    public static final String CONFIG_FORWARD_INTERIM = "forwardInterimResults";
    public static final int DEFAULT_MAX_CHUNK_SIZE = 8192;

    private final List<AudioFormat> supportedFormats = new CopyOnWriteArrayList<>(List.of(AudioFormat.DEFAULT));
    private final ByteArrayOutputStream pendingText = new ByteArrayOutputStream();
    private volatile String lastTranscript;

    public WebSocketTranscriptionNode(String id, String name, URI endpoint,
                                      WebSocketTransportFactory transportFactory, Executor receiveExecutor) {
        super(id, name, endpoint, transportFactory, receiveExecutor);
    }

    @Override
    public List<AudioFormat> getSupportedFormats() {
        return Collections.unmodifiableList(supportedFormats);
    }

    public void setSupportedFormats(List<AudioFormat> formats) {
        supportedFormats.clear();
        supportedFormats.addAll(formats);
    }

    public int getMaxChunkSize() {
        return (int) getConfigurationNumber(CONFIG_MAX_CHUNK_SIZE, DEFAULT_MAX_CHUNK_SIZE);
    }

    public void setMaxChunkSize(int maxChunkSize) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be > 0");
        }
        setConfigurationValue(CONFIG_MAX_CHUNK_SIZE, maxChunkSize);
    }

    public boolean isForwardInterimResults() {
        return getConfigurationFlag(CONFIG_FORWARD_INTERIM, false);
    }

    public void setForwardInterimResults(boolean forward) {
        setConfigurationValue(CONFIG_FORWARD_INTERIM, forward);
    }

    public String getLastTranscript() {
        return lastTranscript;
    }

    @Override
    public boolean acceptAudio(AudioBuffer buffer, ProcessingContext context) {
        if (!isEnabled() || buffer == null) {
            return false;
        }
        if (context != null && context.isCancellationRequested()) {
            return false;
        }
        if (!isFormatSupported(buffer.format())) {
            warn(context, "Node '" + getId() + "' does not support format " + buffer.format());
            return false;
        }
        if (!isStreaming()) {
            warn(context, "Node '" + getId() + "' is not streaming; audio dropped");
            return false;
        }

        long start = System.nanoTime();
        byte[] data = buffer.rawData();
        int chunkSize = getMaxChunkSize();
        for (int offset = 0; offset < data.length; offset += chunkSize) {
            int end = Math.min(data.length, offset + chunkSize);
            byte[] chunk = Arrays.copyOfRange(data, offset, end);
            send(chunk, WebSocketMessageType.BINARY, true);
        }
        Duration elapsed = TimeUtils.elapsedSince(start);
        trackProcessing(elapsed);
        publish(new NodeProcessingEvent(getId(), buffer, null, context, elapsed, Instant.now()));
        return true;
    }

    @Override
    protected void onMessageReceived(byte[] data, WebSocketMessageType messageType,
                                     boolean endOfMessage, ProcessingContext context) {
        if (messageType != WebSocketMessageType.TEXT) {
            return;
        }
        String json;
        synchronized (pendingText) {
            pendingText.write(data, 0, data.length);
            if (!endOfMessage) {
                return;
            }
            json = pendingText.toString(StandardCharsets.UTF_8);
            pendingText.reset();
        }

        TranscriptionJsonParser.parse(json).ifPresentOrElse(transcript -> {
            lastTranscript = transcript.text();
            LOG.debug("Node '{}' transcript (final={}): {}", getId(), transcript.isFinal(),
                    LogSanitizer.preview(transcript.text()));
            publish(new TranscriptionReceivedEvent(getId(), transcript.text(), transcript.isFinal(),
                    context, Instant.now()));
            if (transcript.isFinal() || isForwardInterimResults()) {
                propagateToOutputs(transcript.text(), context);
            }
        }, () -> LOG.debug("Node '{}' ignored non-transcript message", getId()));
    }

    @Override
    protected void doReset() {
        synchronized (pendingText) {
            pendingText.reset();
        }
        lastTranscript = null;
    }

    private void warn(ProcessingContext context, String message) {
        LOG.warn(message);
        if (context != null) {
            context.logWarning(message);
        }
    }
}
