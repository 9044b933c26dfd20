package com.phillippitts.voicegraph.config;

import com.phillippitts.voicegraph.config.properties.PipelineProperties;
import com.phillippitts.voicegraph.service.node.websocket.OkHttpWebSocketTransport;
import com.phillippitts.voicegraph.service.node.websocket.WebSocketTransportFactory;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP/WebSocket client shared by all WebSocket nodes and session-setup resolvers.
 */
@Configuration
public class WebSocketClientConfig {

    /**
     * Client tuned for long-lived streaming sockets: no read or write timeout, periodic pings
     * to keep idle connections alive.
     */
    @Bean(destroyMethod = "")
    public OkHttpClient okHttpClient(PipelineProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getWebsocket().getConnectTimeoutMs(), TimeUnit.MILLISECONDS)
                .pingInterval(30, TimeUnit.SECONDS)
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .writeTimeout(0, TimeUnit.MILLISECONDS)
                .build();
    }

    @Bean
    public WebSocketTransportFactory webSocketTransportFactory(OkHttpClient client, PipelineProperties properties) {
        Duration connectTimeout = Duration.ofMillis(properties.getWebsocket().getConnectTimeoutMs());
        return () -> new OkHttpWebSocketTransport(client, connectTimeout);
    }
}
