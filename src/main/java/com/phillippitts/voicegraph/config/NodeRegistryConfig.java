package com.phillippitts.voicegraph.config;

import com.phillippitts.voicegraph.config.properties.PipelineProperties;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.service.node.io.RawPcmInputNode;
import com.phillippitts.voicegraph.service.node.io.RawPcmOutputNode;
import com.phillippitts.voicegraph.service.node.processor.AudioMixerNode;
import com.phillippitts.voicegraph.service.node.processor.AudioSplitterNode;
import com.phillippitts.voicegraph.service.node.processor.FormatConversionNode;
import com.phillippitts.voicegraph.service.node.processor.PassthroughNode;
import com.phillippitts.voicegraph.service.node.processor.VolumeControlNode;
import com.phillippitts.voicegraph.service.node.text.TextProcessingNode;
import com.phillippitts.voicegraph.service.node.websocket.AbstractWebSocketNode;
import com.phillippitts.voicegraph.service.node.websocket.JoinUrlEndpointResolver;
import com.phillippitts.voicegraph.service.node.websocket.WebSocketConversationNode;
import com.phillippitts.voicegraph.service.node.websocket.WebSocketTextToSpeechNode;
import com.phillippitts.voicegraph.service.node.websocket.WebSocketTranscriptionNode;
import com.phillippitts.voicegraph.service.node.websocket.WebSocketTransportFactory;
import com.phillippitts.voicegraph.service.registry.NodeTypeRegistry;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Populates the {@link NodeTypeRegistry} with the built-in node types.
 *
 * <p>Type keys: {@code raw-pcm-input}, {@code raw-pcm-output}, {@code passthrough},
 * {@code volume}, {@code mixer}, {@code splitter}, {@code format-converter},
 * {@code text-processor}, {@code websocket-transcription}, {@code websocket-tts},
 * {@code websocket-conversation}. Mixer and WebSocket nodes receive their defaults from
 * {@link PipelineProperties}.
 */
@Configuration
public class NodeRegistryConfig {

    private static final Logger LOG = LogManager.getLogger(NodeRegistryConfig.class);

    public static final String RAW_PCM_INPUT = "raw-pcm-input";
    public static final String RAW_PCM_OUTPUT = "raw-pcm-output";
    public static final String PASSTHROUGH = "passthrough";
    public static final String VOLUME = "volume";
    public static final String MIXER = "mixer";
    public static final String SPLITTER = "splitter";
    public static final String FORMAT_CONVERTER = "format-converter";
    public static final String TEXT_PROCESSOR = "text-processor";
    public static final String WEBSOCKET_TRANSCRIPTION = "websocket-transcription";
    public static final String WEBSOCKET_TTS = "websocket-tts";
    public static final String WEBSOCKET_CONVERSATION = "websocket-conversation";

    @Bean
    public NodeTypeRegistry nodeTypeRegistry(PipelineProperties properties,
                                             WebSocketTransportFactory transportFactory,
                                             OkHttpClient httpClient,
                                             @Qualifier("streamingExecutor") Executor streamingExecutor) {
        NodeTypeRegistry registry = new NodeTypeRegistry();
        PipelineProperties.Mixer mixer = properties.getMixer();
        PipelineProperties.WebSocket ws = properties.getWebsocket();

        registry.register(RAW_PCM_INPUT, RawPcmInputNode.class, RawPcmInputNode::new);
        registry.register(RAW_PCM_OUTPUT, RawPcmOutputNode.class, RawPcmOutputNode::new);
        registry.register(PASSTHROUGH, PassthroughNode.class, PassthroughNode::new);
        registry.register(VOLUME, VolumeControlNode.class, VolumeControlNode::new);
        registry.register(SPLITTER, AudioSplitterNode.class, AudioSplitterNode::new);
        registry.register(FORMAT_CONVERTER, FormatConversionNode.class, FormatConversionNode::new);
        registry.register(TEXT_PROCESSOR, TextProcessingNode.class, TextProcessingNode::new);
        registry.register(MIXER, AudioMixerNode.class, (id, name) -> {
            AudioMixerNode node = new AudioMixerNode(id, name);
            node.setMaxBufferAgeMs(mixer.getMaxBufferAgeMs());
            node.setNormalize(mixer.isNormalize());
            return node;
        });
        registry.register(WEBSOCKET_TRANSCRIPTION, WebSocketTranscriptionNode.class, (id, name) -> {
            WebSocketTranscriptionNode node = new WebSocketTranscriptionNode(
                    id, name, endpointOf(ws.getTranscriptionEndpoint()), transportFactory, streamingExecutor);
            node.setMaxChunkSize(ws.getMaxChunkSize());
            applySocketDefaults(node, ws);
            return node;
        });
        registry.register(WEBSOCKET_TTS, WebSocketTextToSpeechNode.class, (id, name) -> {
            WebSocketTextToSpeechNode node = new WebSocketTextToSpeechNode(
                    id, name, endpointOf(ws.getTtsEndpoint()), transportFactory, streamingExecutor);
            applySocketDefaults(node, ws);
            return node;
        });
        PipelineProperties.Conversation conversation = properties.getConversation();
        registry.register(WEBSOCKET_CONVERSATION, WebSocketConversationNode.class, (id, name) -> {
            WebSocketConversationNode node = new WebSocketConversationNode(
                    id, name, endpointOf(conversation.getEndpoint()), transportFactory, streamingExecutor);
            node.setAudioFormat(AudioFormat.pcm16(conversation.getSampleRate(), 1));
            URI sessionUrl = endpointOf(conversation.getSessionUrl());
            if (sessionUrl != null) {
                node.setEndpoint(sessionUrl);
                node.setEndpointResolver(joinUrlResolver(httpClient, sessionUrl, conversation));
            }
            applySocketDefaults(node, ws);
            return node;
        });

        LOG.info("Registered node types: {}", registry.getTypeKeys());
        return registry;
    }

    private static void applySocketDefaults(AbstractWebSocketNode node, PipelineProperties.WebSocket ws) {
        node.setReceiveBufferSize(ws.getReceiveBufferSize());
        node.setReceivePollTimeout(Duration.ofMillis(ws.getReceivePollMs()));
    }

    private static JoinUrlEndpointResolver joinUrlResolver(OkHttpClient httpClient, URI sessionUrl,
                                                           PipelineProperties.Conversation conversation) {
        Map<String, String> headers = conversation.getApiKey() == null || conversation.getApiKey().isBlank()
                ? Map.of()
                : Map.of(conversation.getApiKeyHeader(), conversation.getApiKey());
        return new JoinUrlEndpointResolver(httpClient, sessionUrl, headers,
                WebSocketConversationNode.sessionRequest(conversation.getSystemPrompt(), conversation.getModel(),
                        conversation.getVoice(), conversation.getSampleRate()));
    }

    private static URI endpointOf(String value) {
        return value == null || value.isBlank() ? null : URI.create(value);
    }
}
