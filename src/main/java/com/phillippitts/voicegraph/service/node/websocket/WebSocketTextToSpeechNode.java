package com.phillippitts.voicegraph.service.node.websocket;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.event.SpeechAudioReceivedEvent;
import com.phillippitts.voicegraph.service.event.SpeechCompletedEvent;
import com.phillippitts.voicegraph.service.node.AudioOutputCapable;
import com.phillippitts.voicegraph.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Sends text to a remote text-to-speech service and emits the synthesized audio.
 *
 * <p>Text payloads arriving through {@link #acceptData(Object, ProcessingContext)} are sent
 * as {@code {"text": ..., "voice": ...}}. Inbound binary frames are PCM in the declared
 * output format (24 kHz mono 16-bit unless configured otherwise); each complete message
 * becomes an {@link AudioBuffer} that is propagated and kept for
 * {@link #pullAudioOutput(ProcessingContext)}. A text frame {@code {"audio_complete": true}}
 * ends an utterance; {@code {"error": ...}} ends it unsuccessfully.
 */
public class WebSocketTextToSpeechNode extends AbstractWebSocketNode implements AudioOutputCapable {

    private static final Logger LOG = LogManager.getLogger(WebSocketTextToSpeechNode.class);

    public static final String CONFIG_VOICE = "voice";
    public static final AudioFormat DEFAULT_OUTPUT_FORMAT = AudioFormat.pcm16(24_000, 1);

    private final ByteArrayOutputStream pendingAudio = new ByteArrayOutputStream();
    private volatile AudioFormat outputFormat = DEFAULT_OUTPUT_FORMAT;
    private volatile AudioBuffer lastOutput;

    public WebSocketTextToSpeechNode(String id, String name, URI endpoint,
                                     WebSocketTransportFactory transportFactory, Executor receiveExecutor) {
        super(id, name, endpoint, transportFactory, receiveExecutor);
    }

    @Override
    public AudioFormat getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(AudioFormat outputFormat) {
        this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
    }

    public String getVoice() {
        return getConfigurationValue(CONFIG_VOICE, String.class, null);
    }

    public void setVoice(String voice) {
        setConfigurationValue(CONFIG_VOICE, voice);
    }

    @Override
    public AudioBuffer pullAudioOutput(ProcessingContext context) {
        return lastOutput;
    }

    /**
     * Accepts text (any {@link CharSequence}) for synthesis.
     */
    @Override
    public boolean acceptData(Object payload, ProcessingContext context) {
        if (!isEnabled() || !(payload instanceof CharSequence text)) {
            return false;
        }
        if (!isStreaming()) {
            String message = "Node '" + getId() + "' is not streaming; text dropped";
            LOG.warn(message);
            if (context != null) {
                context.logWarning(message);
            }
            return false;
        }
        synthesize(text.toString());
        return true;
    }

    /**
     * Sends one synthesis request.
     *
     * @throws com.phillippitts.voicegraph.exception.NotConnectedException if not connected
     */
    public void synthesize(String text) {
        JSONObject request = new JSONObject().put("text", text);
        String voice = getVoice();
        if (voice != null && !voice.isBlank()) {
            request.put("voice", voice);
        }
        LOG.debug("Node '{}' synthesizing: {}", getId(), LogSanitizer.preview(text));
        sendText(request.toString());
    }

    @Override
    protected void onMessageReceived(byte[] data, WebSocketMessageType messageType,
                                     boolean endOfMessage, ProcessingContext context) {
        if (messageType == WebSocketMessageType.BINARY) {
            handleAudio(data, endOfMessage, context);
        } else if (messageType == WebSocketMessageType.TEXT) {
            handleControl(new String(data, StandardCharsets.UTF_8), context);
        }
    }

    private void handleAudio(byte[] data, boolean endOfMessage, ProcessingContext context) {
        byte[] audio;
        synchronized (pendingAudio) {
            pendingAudio.write(data, 0, data.length);
            if (!endOfMessage) {
                return;
            }
            audio = pendingAudio.toByteArray();
            pendingAudio.reset();
        }
        if (audio.length == 0) {
            return;
        }
        AudioBuffer buffer = new AudioBuffer(audio, outputFormat);
        lastOutput = buffer;
        publish(new SpeechAudioReceivedEvent(getId(), buffer, context, Instant.now()));
        propagateToOutputs(buffer, context);
    }

    private void handleControl(String json, ProcessingContext context) {
        try {
            JSONObject message = new JSONObject(json);
            if (message.optBoolean("audio_complete", false)) {
                publish(new SpeechCompletedEvent(getId(), true, context, Instant.now()));
            } else if (message.has("error")) {
                String error = message.optString("error", "unknown error");
                getStatus().recordError(error);
                LOG.warn("Node '{}' synthesis error: {}", getId(), error);
                publish(new SpeechCompletedEvent(getId(), false, context, Instant.now()));
            }
        } catch (JSONException e) {
            LOG.debug("Node '{}' ignored non-JSON text frame", getId());
        }
    }

    @Override
    protected void doReset() {
        synchronized (pendingAudio) {
            pendingAudio.reset();
        }
        lastOutput = null;
    }
}
