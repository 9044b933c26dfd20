package com.phillippitts.voicegraph.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults applied to nodes created through the node-type registry.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public class PipelineProperties {

    @Valid
    private Mixer mixer = new Mixer();

    @Valid
    private WebSocket websocket = new WebSocket();

    @Valid
    private Conversation conversation = new Conversation();

    public Mixer getMixer() {
        return mixer;
    }

    public void setMixer(Mixer mixer) {
        this.mixer = mixer;
    }

    public WebSocket getWebsocket() {
        return websocket;
    }

    public void setWebsocket(WebSocket websocket) {
        this.websocket = websocket;
    }

    public Conversation getConversation() {
        return conversation;
    }

    public void setConversation(Conversation conversation) {
        this.conversation = conversation;
    }

    /**
     * Mixer node defaults.
     */
    public static class Mixer {

        /** Buffers older than this are evicted before each mix. */
        @Positive(message = "Mixer max buffer age must be positive")
        private long maxBufferAgeMs = 5000;

        /** Average overlapping sources instead of summing them. */
        private boolean normalize = true;

        public long getMaxBufferAgeMs() {
            return maxBufferAgeMs;
        }

        public void setMaxBufferAgeMs(long maxBufferAgeMs) {
            this.maxBufferAgeMs = maxBufferAgeMs;
        }

        public boolean isNormalize() {
            return normalize;
        }

        public void setNormalize(boolean normalize) {
            this.normalize = normalize;
        }
    }

    /**
     * WebSocket node defaults.
     */
    public static class WebSocket {

        /** Size of the shared receive buffer, in bytes. */
        @Positive(message = "Receive buffer size must be positive")
        private int receiveBufferSize = 32768;

        /** How long one receive call waits before re-checking cancellation. */
        @Positive(message = "Receive poll interval must be positive")
        private long receivePollMs = 200;

        @Positive(message = "Connect timeout must be positive")
        private long connectTimeoutMs = 10_000;

        /** Largest binary frame sent by the transcription node. */
        @Positive(message = "Max chunk size must be positive")
        private int maxChunkSize = 8192;

        /** Endpoint for nodes of type {@code websocket-transcription}; optional. */
        private String transcriptionEndpoint;

        /** Endpoint for nodes of type {@code websocket-tts}; optional. */
        private String ttsEndpoint;

        public int getReceiveBufferSize() {
            return receiveBufferSize;
        }

        public void setReceiveBufferSize(int receiveBufferSize) {
            this.receiveBufferSize = receiveBufferSize;
        }

        public long getReceivePollMs() {
            return receivePollMs;
        }

        public void setReceivePollMs(long receivePollMs) {
            this.receivePollMs = receivePollMs;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getMaxChunkSize() {
            return maxChunkSize;
        }

        public void setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
        }

        public String getTranscriptionEndpoint() {
            return transcriptionEndpoint;
        }

        public void setTranscriptionEndpoint(String transcriptionEndpoint) {
            this.transcriptionEndpoint = transcriptionEndpoint;
        }

        public String getTtsEndpoint() {
            return ttsEndpoint;
        }

        public void setTtsEndpoint(String ttsEndpoint) {
            this.ttsEndpoint = ttsEndpoint;
        }
    }

    /**
     * Defaults for nodes of type {@code websocket-conversation}.
     *
     * <p>When {@code sessionUrl} is set, each node first POSTs a session request there and
     * connects to the returned join URL; otherwise it connects to {@code endpoint} directly.
     */
    public static class Conversation {

        /** Direct socket endpoint; optional. */
        private String endpoint;

        /** Call-creation endpoint that answers with a {@code joinUrl}; optional. */
        private String sessionUrl;

        private String apiKey;

        private String apiKeyHeader = "X-API-Key";

        private String voice = "Mark";

        private String model = "fixie-ai/ultravox";

        private String systemPrompt = "You are a helpful assistant answering phone calls.";

        /** Sample rate of audio in both directions. */
        @Positive(message = "Conversation sample rate must be positive")
        private int sampleRate = 8000;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getSessionUrl() {
            return sessionUrl;
        }

        public void setSessionUrl(String sessionUrl) {
            this.sessionUrl = sessionUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiKeyHeader() {
            return apiKeyHeader;
        }

        public void setApiKeyHeader(String apiKeyHeader) {
            this.apiKeyHeader = apiKeyHeader;
        }

        public String getVoice() {
            return voice;
        }

        public void setVoice(String voice) {
            this.voice = voice;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getSystemPrompt() {
            return systemPrompt;
        }

        public void setSystemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
        }

        public int getSampleRate() {
            return sampleRate;
        }

        public void setSampleRate(int sampleRate) {
            this.sampleRate = sampleRate;
        }
    }
}
