package com.phillippitts.voicegraph.service.pipeline;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.CancellationSource;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs pipeline passes asynchronously on an executor and lets the caller cancel them.
 *
 * <p>Only one pass per executor instance is accepted at a time; a second call while one is
 * in flight completes exceptionally with {@link IllegalStateException}. A failed pass
 * completes normally with an empty list: the failure itself is reported through the
 * pipeline's failed event and the log.
 *
 * @since 1.0
 */
public class PipelineExecutor {

    private static final Logger LOG = LogManager.getLogger(PipelineExecutor.class);

    private final Pipeline pipeline;
    private final Executor executor;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CancellationSource currentRun;

    public PipelineExecutor(Pipeline pipeline, Executor executor) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public CompletableFuture<List<AudioBuffer>> executeAsync(AudioBuffer input) {
        return executeAsync(input, null);
    }

    /**
     * Submits one pass.
     *
     * @param sessionId session to run under, or {@code null} for a fresh one
     */
    public CompletableFuture<List<AudioBuffer>> executeAsync(AudioBuffer input, UUID sessionId) {
        Objects.requireNonNull(input, "input");
        if (!running.compareAndSet(false, true)) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Pipeline '" + pipeline.getId() + "' is already running"));
        }
        CancellationSource cancellation = new CancellationSource();
        currentRun = cancellation;
        ProcessingContext context = new ProcessingContext(sessionId, cancellation.token());

        CompletableFuture<List<AudioBuffer>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> pipeline.execute(input, context), executor);
        } catch (RuntimeException e) {
            finish(cancellation);
            return CompletableFuture.failedFuture(e);
        }
        return future.handle((results, error) -> {
            finish(cancellation);
            if (error != null) {
                LOG.warn("Async execution of pipeline '{}' failed: {}", pipeline.getId(), error.getMessage());
                return List.<AudioBuffer>of();
            }
            return results;
        });
    }

    /**
     * Requests cancellation of the pass in flight, if any.
     */
    public void cancel() {
        CancellationSource cancellation = currentRun;
        if (cancellation != null) {
            cancellation.cancel();
            LOG.info("Cancellation requested for pipeline '{}'", pipeline.getId());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    private void finish(CancellationSource cancellation) {
        cancellation.close();
        if (currentRun == cancellation) {
            currentRun = null;
        }
        running.set(false);
    }
}
