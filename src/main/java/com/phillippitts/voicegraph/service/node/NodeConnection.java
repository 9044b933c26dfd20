package com.phillippitts.voicegraph.service.node;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.exception.ConnectionIncompatibleException;
import com.phillippitts.voicegraph.service.event.DataTransferredEvent;
import com.phillippitts.voicegraph.service.event.EventPublishing;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directed edge between two nodes of the same pipeline.
 *
 * <p>Audio connections check at validation time that the source can emit audio, the target
 * can accept it, and the source's output format is among the target's supported formats.
 * Text connections skip the format check.
 *
 * <p>The {@code channelId} configuration key tags a connection for one splitter channel.
 */
public class NodeConnection {

    private static final Logger LOG = LogManager.getLogger(NodeConnection.class);

    public static final String KIND_AUDIO = "audio";
    public static final String KIND_TEXT = "text";
    public static final String CONFIG_CHANNEL_ID = "channelId";

    private final String id;
    private final Node source;
    private final Node target;
    private volatile String label;
    private volatile boolean enabled = true;
    private volatile int priority;
    private volatile String kind = KIND_AUDIO;
    private final Map<String, Object> configuration = new ConcurrentHashMap<>();
    private volatile ConnectionValidationState validationState = ConnectionValidationState.NOT_VALIDATED;
    private volatile ApplicationEventPublisher eventPublisher;

    public NodeConnection(String id, Node source, Node target) {
        this.id = Objects.requireNonNull(id, "id");
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
        this.label = source.getName() + " → " + target.getName();
    }

    public String getId() {
        return id;
    }

    public Node getSource() {
        return source;
    }

    public Node getTarget() {
        return target;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Lower values are delivered first.
     */
    public void setPriority(int priority) {
        this.priority = priority;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    public void setConfigurationValue(String key, Object value) {
        if (value == null) {
            configuration.remove(key);
        } else {
            configuration.put(key, value);
        }
    }

    /**
     * Splitter channel this connection is tagged with, or {@code null} if untagged.
     */
    public String getChannelId() {
        Object value = configuration.get(CONFIG_CHANNEL_ID);
        return value == null ? null : value.toString();
    }

    public ConnectionValidationState getValidationState() {
        return validationState;
    }

    public void setEventPublisher(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    /**
     * Checks capability and format compatibility, then runs both nodes' self checks.
     *
     * @return {@code true} if both node self checks pass
     * @throws ConnectionIncompatibleException if capabilities or formats do not match
     */
    public boolean validate() {
        if (KIND_AUDIO.equals(kind)) {
            validateAudioCompatibility();
        }
        boolean sourceValid = source.validate();
        boolean targetValid = target.validate();
        boolean valid = sourceValid && targetValid;
        validationState = valid ? ConnectionValidationState.VALID : ConnectionValidationState.INVALID;
        if (!valid) {
            LOG.warn("Connection '{}' failed node self-check (source={}, target={})",
                    id, sourceValid, targetValid);
        }
        return valid;
    }

    private void validateAudioCompatibility() {
        if (!source.hasCapability(NodeCapability.AUDIO_OUTPUT)
                || !target.hasCapability(NodeCapability.AUDIO_INPUT)) {
            throw incompatible("Invalid audio connection: '" + source.getId()
                    + "' cannot output audio or '" + target.getId() + "' cannot accept audio");
        }
        AudioFormat outputFormat = ((AudioOutputCapable) source).getOutputFormat();
        if (outputFormat == null) {
            throw incompatible("Source '" + source.getId() + "' declares no output format");
        }
        List<AudioFormat> supported = ((AudioInputCapable) target).getSupportedFormats();
        if (!supported.isEmpty() && !supported.contains(outputFormat)) {
            throw incompatible("Incompatible formats: " + outputFormat
                    + " is not supported by '" + target.getId() + "' " + supported);
        }
    }

    private ConnectionIncompatibleException incompatible(String message) {
        validationState = ConnectionValidationState.INCOMPATIBLE;
        return new ConnectionIncompatibleException(source.getId(), target.getId(), message);
    }

    /**
     * Delivers a payload to the target. Audio buffers go to audio-capable targets; any other
     * payload is offered to {@link Node#acceptData(Object, ProcessingContext)}.
     *
     * @return {@code true} if the target accepted the payload
     */
    public boolean transferData(Object data, ProcessingContext context) {
        if (!enabled || data == null) {
            return false;
        }
        boolean accepted;
        if (data instanceof AudioBuffer buffer && target.hasCapability(NodeCapability.AUDIO_INPUT)) {
            accepted = ((AudioInputCapable) target).acceptAudio(buffer, context);
        } else {
            accepted = target.acceptData(data, context);
        }
        if (accepted) {
            EventPublishing.publish(eventPublisher, new DataTransferredEvent(
                    id, source.getId(), target.getId(), data, context, Instant.now()));
        }
        return accepted;
    }

    @Override
    public String toString() {
        return "NodeConnection[" + id + ": " + label + "]";
    }
}
