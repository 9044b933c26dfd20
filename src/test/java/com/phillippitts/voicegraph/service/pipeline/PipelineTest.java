package com.phillippitts.voicegraph.service.pipeline;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.CancellationSource;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.exception.ConnectionIncompatibleException;
import com.phillippitts.voicegraph.exception.GraphException;
import com.phillippitts.voicegraph.exception.NoEntryPointsException;
import com.phillippitts.voicegraph.exception.PipelineExecutionException;
import com.phillippitts.voicegraph.service.event.DataTransferredEvent;
import com.phillippitts.voicegraph.service.event.PipelineExecutionCancelledEvent;
import com.phillippitts.voicegraph.service.event.PipelineExecutionCompletedEvent;
import com.phillippitts.voicegraph.service.event.PipelineExecutionFailedEvent;
import com.phillippitts.voicegraph.service.event.PipelineExecutionStartedEvent;
import com.phillippitts.voicegraph.service.node.NodeConnection;
import com.phillippitts.voicegraph.service.node.io.RawPcmInputNode;
import com.phillippitts.voicegraph.service.node.io.RawPcmOutputNode;
import com.phillippitts.voicegraph.testutil.EventCapturingPublisher;
import com.phillippitts.voicegraph.testutil.RecordingNode;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PipelineTest {

    private EventCapturingPublisher publisher;
    private Pipeline pipeline;
    private RawPcmInputNode input;
    private RawPcmOutputNode output;

    @BeforeEach
    void setUp() {
        publisher = new EventCapturingPublisher();
        pipeline = new Pipeline("p", "Test pipeline", publisher);
        input = new RawPcmInputNode("in", "Input");
        output = new RawPcmOutputNode("out", "Output");
    }

    @Test
    void inputIsDeliveredToExitPointUnchanged() {
        pipeline.addNode(input);
        pipeline.addNode(output);
        pipeline.connect("in", "out");
        AudioBuffer buffer = new AudioBuffer(new byte[100], AudioFormat.DEFAULT);

        List<AudioBuffer> results = pipeline.execute(buffer);

        assertThat(results).containsExactly(buffer);
        assertThat(publisher.ofType(PipelineExecutionStartedEvent.class)).hasSize(1);
        assertThat(publisher.ofType(PipelineExecutionCompletedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.results()).containsExactly(buffer));
    }

    @Test
    void entryAndExitPointsFollowCapabilities() {
        pipeline.addNode(input);
        pipeline.addNode(output);
        RecordingNode processor = new RecordingNode("proc");
        pipeline.addNode(processor);

        assertThat(pipeline.getEntryPoints()).containsExactly(input, processor);
        assertThat(pipeline.getExitPoints()).containsExactly(output, processor);

        pipeline.removeNode("proc");

        assertThat(pipeline.getEntryPoints()).containsExactly(input);
        assertThat(pipeline.getExitPoints()).containsExactly(output);
    }

    @Test
    void duplicateNodeIdIsRejectedWithoutChangingGraph() {
        pipeline.addNode(input);

        assertThatThrownBy(() -> pipeline.addNode(new RawPcmInputNode("in", "Other")))
                .isInstanceOf(GraphException.class)
                .hasMessageContaining("already exists");
        assertThat(pipeline.getNodes()).containsOnlyKeys("in");
        assertThat(pipeline.getNode("in")).isSameAs(input);
    }

    @Test
    void nodeOwnedByAnotherPipelineIsRejected() {
        Pipeline other = new Pipeline("other", "Other");
        other.addNode(input);

        assertThatThrownBy(() -> pipeline.addNode(input))
                .isInstanceOf(GraphException.class)
                .hasMessageContaining("already belongs to pipeline 'other'");
    }

    @Test
    void removeNodeDropsItsConnectionsAndReleasesOwnership() {
        RecordingNode processor = new RecordingNode("proc");
        pipeline.addNode(input);
        pipeline.addNode(processor);
        pipeline.addNode(output);
        pipeline.connect("in", "proc", "c1");
        pipeline.connect("proc", "out", "c2");

        pipeline.removeNode("proc");

        assertThat(pipeline.getConnections()).isEmpty();
        assertThat(input.getOutputConnections()).isEmpty();
        assertThat(output.getInputConnections()).isEmpty();
        assertThat(processor.getOwnerPipelineId()).isEmpty();
    }

    @Test
    void unknownIdsAreRejected() {
        pipeline.addNode(input);

        assertThatThrownBy(() -> pipeline.connect("in", "missing"))
                .isInstanceOf(GraphException.class)
                .hasMessageContaining("'missing' not found");
        assertThatThrownBy(() -> pipeline.removeNode("missing"))
                .isInstanceOf(GraphException.class);
        assertThatThrownBy(() -> pipeline.removeConnection("missing"))
                .isInstanceOf(GraphException.class);
    }

    @Test
    void duplicateConnectionIdIsRejected() {
        pipeline.addNode(input);
        pipeline.addNode(output);
        pipeline.connect("in", "out", "c1");

        assertThatThrownBy(() -> pipeline.connect("in", "out", "c1"))
                .isInstanceOf(GraphException.class);
        assertThat(pipeline.getConnections()).hasSize(1);
    }

    @Test
    void generatedConnectionIdsAreUnique() {
        pipeline.addNode(input);
        pipeline.addNode(output);

        NodeConnection first = pipeline.connect("in", "out");
        NodeConnection second = pipeline.connect("in", "out");

        assertThat(first.getId()).startsWith("conn_in_out_").isNotEqualTo(second.getId());
    }

    @Test
    void connectByReferenceRequiresRegisteredNodes() {
        pipeline.addNode(input);

        assertThatThrownBy(() -> pipeline.connect(input, output, null))
                .isInstanceOf(GraphException.class)
                .hasMessageContaining("is not in this pipeline");
    }

    @Test
    void executionWithoutEntryPointsFails() {
        pipeline.addNode(output);

        assertThatThrownBy(() -> pipeline.execute(new AudioBuffer(new byte[2], AudioFormat.DEFAULT)))
                .isInstanceOf(NoEntryPointsException.class);
        assertThat(pipeline.isRunning()).isFalse();
        assertThat(publisher.ofType(PipelineExecutionFailedEvent.class)).hasSize(1);
    }

    @Test
    void disabledEntryPointsDoNotCount() {
        pipeline.addNode(input);
        input.setEnabled(false);

        assertThatThrownBy(() -> pipeline.execute(new AudioBuffer(new byte[2], AudioFormat.DEFAULT)))
                .isInstanceOf(NoEntryPointsException.class);
    }

    @Test
    void nodeFailureIsWrappedAndReported() {
        RecordingNode processor = new RecordingNode("proc");
        processor.onProcess = ctx -> {
            throw new IllegalStateException("boom");
        };
        pipeline.addNode(processor);

        assertThatThrownBy(() -> pipeline.execute(new AudioBuffer(new byte[2], AudioFormat.DEFAULT)))
                .isInstanceOf(PipelineExecutionException.class)
                .hasMessageContaining("boom")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(pipeline.isRunning()).isFalse();
        assertThat(publisher.ofType(PipelineExecutionFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.error()).isInstanceOf(IllegalStateException.class));
        assertThat(processor.getStatus().getLastError()).isEqualTo("boom");
    }

    @Test
    void cancellationDuringPassReturnsNoResults() {
        CancellationSource cancellation = new CancellationSource();
        RecordingNode processor = new RecordingNode("proc");
        processor.onProcess = ctx -> cancellation.cancel();
        pipeline.addNode(processor);
        pipeline.addNode(output);
        pipeline.connect("proc", "out");

        List<AudioBuffer> results = pipeline.execute(new AudioBuffer(new byte[2], AudioFormat.DEFAULT),
                new ProcessingContext(null, cancellation.token()));

        assertThat(results).isEmpty();
        assertThat(output.pullAudioOutput(null)).isNull();
        assertThat(publisher.ofType(PipelineExecutionCancelledEvent.class)).hasSize(1);
        assertThat(publisher.ofType(PipelineExecutionCompletedEvent.class)).isEmpty();
    }

    @Test
    void everyEntryPointIsFedFewestInputsFirst() {
        RecordingNode processor = new RecordingNode("proc");
        pipeline.addNode(processor);
        pipeline.addNode(input);
        pipeline.connect("in", "proc");
        AudioBuffer buffer = new AudioBuffer(new byte[4], AudioFormat.DEFAULT);

        pipeline.execute(buffer);

        assertThat(processor.received).hasSize(2).allSatisfy(b -> assertThat(b).isSameAs(buffer));
        assertThat(input.nextQueuedAudio()).isSameAs(buffer);
    }

    @Test
    void concurrentExecuteWaitsForRunningPass() throws Exception {
        RecordingNode gate = new RecordingNode("gate");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        gate.onProcess = ctx -> {
            if (calls.incrementAndGet() == 1) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        };
        pipeline.addNode(gate);
        AudioBuffer first = new AudioBuffer(new byte[2], AudioFormat.DEFAULT);
        AudioBuffer second = new AudioBuffer(new byte[4], AudioFormat.DEFAULT);

        FutureTask<List<AudioBuffer>> firstPass = new FutureTask<>(() -> pipeline.execute(first));
        FutureTask<List<AudioBuffer>> secondPass = new FutureTask<>(() -> pipeline.execute(second));
        Thread firstThread = new Thread(firstPass, "first-pass");
        Thread secondThread = new Thread(secondPass, "second-pass");
        firstThread.start();
        assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

        secondThread.start();
        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> secondThread.getState() == Thread.State.WAITING);

        assertThat(gate.received).containsExactly(first);
        assertThat(secondPass.isDone()).isFalse();
        assertThat(publisher.ofType(PipelineExecutionStartedEvent.class)).hasSize(1);

        release.countDown();

        assertThat(firstPass.get(2, TimeUnit.SECONDS)).containsExactly(first);
        assertThat(secondPass.get(2, TimeUnit.SECONDS)).containsExactly(second);
        assertThat(gate.received).containsExactly(first, second);
        assertThat(publisher.ofType(PipelineExecutionCompletedEvent.class)).hasSize(2);
        assertThat(publisher.ofType(PipelineExecutionFailedEvent.class)).isEmpty();
    }

    @Test
    void transfersAreRecordedInExecutionLogUntilReset() {
        pipeline.addNode(input);
        pipeline.addNode(output);
        pipeline.connect("in", "out", "c1");

        pipeline.execute(new AudioBuffer(new byte[2], AudioFormat.DEFAULT));

        assertThat(pipeline.getExecutionLog()).singleElement().satisfies(e -> {
            assertThat(e.connectionId()).isEqualTo("c1");
            assertThat(e.sourceNodeId()).isEqualTo("in");
            assertThat(e.targetNodeId()).isEqualTo("out");
        });
        assertThat(publisher.ofType(DataTransferredEvent.class)).hasSize(1);

        pipeline.reset();

        assertThat(pipeline.getExecutionLog()).isEmpty();
        assertThat(output.pullAudioOutput(null)).isNull();
    }

    @Test
    void diagnosticContextIsSetDuringPassAndRemovedAfter() {
        AtomicReference<String> seenPipeline = new AtomicReference<>();
        AtomicReference<String> seenSession = new AtomicReference<>();
        RecordingNode processor = new RecordingNode("proc");
        processor.onProcess = ctx -> {
            seenPipeline.set(ThreadContext.get("pipelineId"));
            seenSession.set(ThreadContext.get("sessionId"));
        };
        pipeline.addNode(processor);
        ProcessingContext context = new ProcessingContext();

        pipeline.execute(new AudioBuffer(new byte[2], AudioFormat.DEFAULT), context);

        assertThat(seenPipeline.get()).isEqualTo("p");
        assertThat(seenSession.get()).isEqualTo(context.getSessionId().toString());
        assertThat(ThreadContext.get("pipelineId")).isNull();
        assertThat(ThreadContext.get("executionId")).isNull();
    }

    @Test
    void transientDataIsClearedAfterEachPass() {
        RecordingNode processor = new RecordingNode("proc");
        processor.onProcess = ctx -> ctx.setTransientData("scratch", 1);
        pipeline.addNode(processor);
        ProcessingContext context = new ProcessingContext();
        context.setSessionData("caller", "kept");

        pipeline.execute(new AudioBuffer(new byte[2], AudioFormat.DEFAULT), context);

        assertThat(context.hasTransientData("scratch")).isFalse();
        assertThat(context.getSessionData("caller", String.class, null)).isEqualTo("kept");
    }

    @Test
    void executeMultipleRunsOnePassPerInput() {
        pipeline.addNode(input);
        pipeline.addNode(output);
        pipeline.connect("in", "out");
        AudioBuffer first = new AudioBuffer(new byte[2], AudioFormat.DEFAULT);
        AudioBuffer second = new AudioBuffer(new byte[4], AudioFormat.DEFAULT);

        List<AudioBuffer> results = pipeline.executeMultiple(List.of(first, second), null);

        assertThat(results).containsExactly(first, second);
        assertThat(publisher.ofType(PipelineExecutionCompletedEvent.class)).hasSize(2);
    }

    @Test
    void initializeReportsIncompatibleFormats() {
        RecordingNode source = new RecordingNode("a");
        RecordingNode target = new RecordingNode("b");
        target.setSupportedFormats(List.of(AudioFormat.CD));
        pipeline.addNode(source);
        pipeline.addNode(target);
        pipeline.connect("a", "b");

        assertThatThrownBy(pipeline::initialize)
                .isInstanceOf(ConnectionIncompatibleException.class);
    }

    @Test
    void initializeReturnsFalseWhenNodeSelfCheckFails() {
        RecordingNode source = new RecordingNode("a");
        RecordingNode target = new RecordingNode("b");
        target.valid = false;
        pipeline.addNode(source);
        pipeline.addNode(target);
        pipeline.connect("a", "b");

        assertThat(pipeline.initialize()).isFalse();
        assertThat(source.getStatus().isInitialized()).isTrue();
    }

    @Test
    void blankIdIsRejected() {
        assertThatThrownBy(() -> new Pipeline(" ", "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new Pipeline("id", null).getName()).isEqualTo("id");
    }
}
