package com.phillippitts.voicegraph.service.node.websocket;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.event.NodeProcessingEvent;
import com.phillippitts.voicegraph.service.event.SpeechAudioReceivedEvent;
import com.phillippitts.voicegraph.service.event.TranscriptionReceivedEvent;
import com.phillippitts.voicegraph.service.node.AudioInputCapable;
import com.phillippitts.voicegraph.service.node.AudioOutputCapable;
import com.phillippitts.voicegraph.service.node.NodeConnection;
import com.phillippitts.voicegraph.util.LogSanitizer;
import com.phillippitts.voicegraph.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Full-duplex voice agent over one socket: caller audio goes up, agent speech comes back.
 *
 * <p>Accepted audio is sent as one binary frame per buffer while the node is streaming.
 * Inbound binary frames are agent speech in the node's audio format; each becomes an
 * {@link AudioBuffer} that is published, kept for {@link #pullAudioOutput(ProcessingContext)}
 * and propagated over audio connections. Inbound text frames {@code {"text", "is_final"}}
 * are transcripts (final unless flagged otherwise); final ones are propagated over text
 * connections. Text payloads delivered to the node are sent as {@code {"text": ...}} so
 * the agent speaks them.
 *
 * <p>Services that hand out a per-call socket are reached through a
 * {@link JoinUrlEndpointResolver} set with {@link #setEndpointResolver(EndpointResolver)}.
 */
public class WebSocketConversationNode extends AbstractWebSocketNode
        implements AudioInputCapable, AudioOutputCapable {

    private static final Logger LOG = LogManager.getLogger(WebSocketConversationNode.class);

    public static final AudioFormat DEFAULT_AUDIO_FORMAT = AudioFormat.pcm16(8_000, 1);

    private volatile AudioFormat audioFormat = DEFAULT_AUDIO_FORMAT;
    private volatile AudioBuffer lastOutput;
    private volatile String lastTranscript;

    public WebSocketConversationNode(String id, String name, URI endpoint,
                                     WebSocketTransportFactory transportFactory, Executor receiveExecutor) {
        super(id, name, endpoint, transportFactory, receiveExecutor);
    }

    /**
     * Builds the session request that asks the service for a join URL.
     */
    public static JSONObject sessionRequest(String systemPrompt, String model, String voice, int sampleRate) {
        JSONObject serverWebSocket = new JSONObject()
                .put("inputSampleRate", sampleRate)
                .put("outputSampleRate", sampleRate);
        JSONObject request = new JSONObject()
                .put("medium", new JSONObject().put("serverWebSocket", serverWebSocket));
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            request.put("systemPrompt", systemPrompt);
        }
        if (model != null && !model.isBlank()) {
            request.put("model", model);
        }
        if (voice != null && !voice.isBlank()) {
            request.put("voice", voice);
        }
        return request;
    }

    /**
     * Format of both the audio sent upstream and the speech received back.
     */
    public AudioFormat getAudioFormat() {
        return audioFormat;
    }

    public void setAudioFormat(AudioFormat audioFormat) {
        this.audioFormat = Objects.requireNonNull(audioFormat, "audioFormat");
    }

    @Override
    public List<AudioFormat> getSupportedFormats() {
        return List.of(audioFormat);
    }

    @Override
    public AudioFormat getOutputFormat() {
        return audioFormat;
    }

    @Override
    public AudioBuffer pullAudioOutput(ProcessingContext context) {
        return lastOutput;
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
        send(buffer.rawData(), WebSocketMessageType.BINARY, true);
        Duration elapsed = TimeUtils.elapsedSince(start);
        trackProcessing(elapsed);
        publish(new NodeProcessingEvent(getId(), buffer, null, context, elapsed, Instant.now()));
        return true;
    }

    /**
     * Accepts text (any {@link CharSequence}) for the agent to speak.
     */
    @Override
    public boolean acceptData(Object payload, ProcessingContext context) {
        if (!isEnabled() || !(payload instanceof CharSequence text)) {
            return false;
        }
        if (!isStreaming()) {
            warn(context, "Node '" + getId() + "' is not streaming; text dropped");
            return false;
        }
        speak(text.toString());
        return true;
    }

    /**
     * Asks the agent to speak {@code text}.
     *
     * @throws com.phillippitts.voicegraph.exception.NotConnectedException if not connected
     */
    public void speak(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        LOG.debug("Node '{}' speaking: {}", getId(), LogSanitizer.preview(text));
        sendText(new JSONObject().put("text", text).toString());
    }

    @Override
    protected void onMessageReceived(byte[] data, WebSocketMessageType messageType,
                                     boolean endOfMessage, ProcessingContext context) {
        if (messageType == WebSocketMessageType.BINARY) {
            if (data.length == 0) {
                return;
            }
            AudioBuffer speech = new AudioBuffer(data, audioFormat);
            lastOutput = speech;
            publish(new SpeechAudioReceivedEvent(getId(), speech, context, Instant.now()));
            propagateToOutputs(speech, context,
                    connection -> NodeConnection.KIND_AUDIO.equals(connection.getKind()));
        } else if (messageType == WebSocketMessageType.TEXT) {
            String json = new String(data, StandardCharsets.UTF_8);
            TranscriptionJsonParser.parse(json, true).ifPresentOrElse(transcript -> {
                lastTranscript = transcript.text();
                LOG.debug("Node '{}' transcript (final={}): {}", getId(), transcript.isFinal(),
                        LogSanitizer.preview(transcript.text()));
                publish(new TranscriptionReceivedEvent(getId(), transcript.text(), transcript.isFinal(),
                        context, Instant.now()));
                if (transcript.isFinal()) {
                    propagateToOutputs(transcript.text(), context,
                            connection -> NodeConnection.KIND_TEXT.equals(connection.getKind()));
                }
            }, () -> LOG.debug("Node '{}' ignored non-transcript message", getId()));
        }
    }

    @Override
    protected void doReset() {
        lastOutput = null;
        lastTranscript = null;
    }

    private void warn(ProcessingContext context, String message) {
        LOG.warn(message);
        if (context != null) {
            context.logWarning(message);
        }
    }
}
