package com.phillippitts.voicegraph.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Sizes of the two executors: {@code threadpool.pipeline.*} for asynchronous execution
 * passes and {@code threadpool.streaming.*} for WebSocket receive loops.
 *
 * <p>A streaming node holds one receive-loop thread for as long as it streams, so the
 * streaming pool defaults to a direct hand-off (queue capacity 0).
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private Pool pipeline = new Pool(4, 8, 50);

    @Valid
    private Pool streaming = new Pool(2, 16, 0);

    public Pool getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pool pipeline) {
        this.pipeline = pipeline;
    }

    public Pool getStreaming() {
        return streaming;
    }

    public void setStreaming(Pool streaming) {
        this.streaming = streaming;
    }

    /**
     * Sizing of one pool.
     */
    public static class Pool {

        @Positive(message = "Core pool size must be positive")
        private int corePoolSize;

        @Positive(message = "Max pool size must be positive")
        private int maxPoolSize;

        @PositiveOrZero(message = "Queue capacity must not be negative")
        private int queueCapacity;

        public Pool() {
        }

        public Pool(int corePoolSize, int maxPoolSize, int queueCapacity) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
