package com.phillippitts.voicegraph.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for pipeline execution and node activity.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Execution latency per pipeline</li>
 *   <li>Execution outcomes per pipeline (completed, cancelled, failed)</li>
 *   <li>Per-node processing time</li>
 *   <li>Data transfers per source node</li>
 *   <li>WebSocket connection state transitions and transcripts received</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "voicegraph";

    public static final String OUTCOME_COMPLETED = "completed";
    public static final String OUTCOME_CANCELLED = "cancelled";
    public static final String OUTCOME_FAILED = "failed";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the wall-clock duration of one execution pass.
     *
     * @param pipelineId pipeline id
     * @param durationNanos duration in nanoseconds
     */
    public void recordExecutionLatency(String pipelineId, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".pipeline.execution.latency")
                .description("Time taken by one pipeline execution pass")
                .tag("pipeline", pipelineId)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the outcome counter of a pipeline.
     *
     * @param pipelineId pipeline id
     * @param outcome completed, cancelled or failed
     */
    public void incrementOutcome(String pipelineId, String outcome) {
        Counter.builder(METRIC_PREFIX + ".pipeline.executions")
                .description("Number of pipeline execution passes by outcome")
                .tag("pipeline", pipelineId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordNodeProcessing(String nodeId, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".node.processing")
                .description("Time taken by a node's processing hook")
                .tag("node", nodeId)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementTransfer(String sourceNodeId) {
        Counter.builder(METRIC_PREFIX + ".connection.transfers")
                .description("Number of payloads accepted by downstream nodes")
                .tag("source", sourceNodeId)
                .register(registry)
                .increment();
    }

    public void incrementConnectionState(String nodeId, String state) {
        Counter.builder(METRIC_PREFIX + ".websocket.state.changes")
                .description("Number of WebSocket state transitions by resulting state")
                .tag("node", nodeId)
                .tag("state", state)
                .register(registry)
                .increment();
    }

    public void incrementTranscripts(String nodeId, boolean isFinal) {
        Counter.builder(METRIC_PREFIX + ".transcripts")
                .description("Number of transcripts received from speech services")
                .tag("node", nodeId)
                .tag("final", String.valueOf(isFinal))
                .register(registry)
                .increment();
    }
}
