package com.phillippitts.voicegraph.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes gauges for the pipeline and streaming thread pools.
 *
 * <p>Each gauge is tagged {@code pool=pipeline} or {@code pool=streaming}:
 * <ul>
 *   <li>voicegraph.pool.size - Current number of threads</li>
 *   <li>voicegraph.pool.active - Threads actively executing tasks</li>
 *   <li>voicegraph.pool.queued - Tasks waiting in the queue</li>
 *   <li>voicegraph.pool.completed - Cumulative count of completed tasks</li>
 *   <li>voicegraph.pool.max.size - Configured maximum pool size</li>
 * </ul>
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> streamingExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider,
            @Qualifier("streamingExecutor") ObjectProvider<ThreadPoolTaskExecutor> streamingExecutorProvider) {
        this.pipelineExecutorProvider = pipelineExecutorProvider;
        this.streamingExecutorProvider = streamingExecutorProvider;
    }

    @Bean
    public MeterBinder threadPoolMetrics() {
        return registry -> {
            bind(registry, "pipeline", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "streaming", streamingExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: voicegraph.pool.*");
        };
    }

    static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Tags tags = Tags.of("pool", pool);

        Gauge.builder("voicegraph.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tags(tags)
                .register(registry);

        Gauge.builder("voicegraph.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tags(tags)
                .register(registry);

        Gauge.builder("voicegraph.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tags(tags)
                .register(registry);

        Gauge.builder("voicegraph.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tags(tags)
                .register(registry);

        Gauge.builder("voicegraph.pool.max.size", executor, ThreadPoolExecutor::getMaximumPoolSize)
                .description("Configured maximum pool size")
                .tags(tags)
                .register(registry);
    }
}
