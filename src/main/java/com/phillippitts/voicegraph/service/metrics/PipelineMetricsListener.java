package com.phillippitts.voicegraph.service.metrics;

import com.phillippitts.voicegraph.service.event.ConnectionStateChangedEvent;
import com.phillippitts.voicegraph.service.event.DataTransferredEvent;
import com.phillippitts.voicegraph.service.event.NodeProcessingEvent;
import com.phillippitts.voicegraph.service.event.PipelineExecutionCancelledEvent;
import com.phillippitts.voicegraph.service.event.PipelineExecutionCompletedEvent;
import com.phillippitts.voicegraph.service.event.PipelineExecutionFailedEvent;
import com.phillippitts.voicegraph.service.event.TranscriptionReceivedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Feeds {@link PipelineMetrics} from pipeline and node notifications.
 */
@Component
public class PipelineMetricsListener {

    private final PipelineMetrics metrics;

    public PipelineMetricsListener(PipelineMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    void onCompleted(PipelineExecutionCompletedEvent e) {
        metrics.recordExecutionLatency(e.pipelineId(), e.duration().toNanos());
        metrics.incrementOutcome(e.pipelineId(), PipelineMetrics.OUTCOME_COMPLETED);
    }

    @EventListener
    void onCancelled(PipelineExecutionCancelledEvent e) {
        metrics.incrementOutcome(e.pipelineId(), PipelineMetrics.OUTCOME_CANCELLED);
    }

    @EventListener
    void onFailed(PipelineExecutionFailedEvent e) {
        metrics.incrementOutcome(e.pipelineId(), PipelineMetrics.OUTCOME_FAILED);
    }

    @EventListener
    void onNodeProcessing(NodeProcessingEvent e) {
        if (e.processingTime() != null) {
            metrics.recordNodeProcessing(e.nodeId(), e.processingTime().toNanos());
        }
    }

    @EventListener
    void onTransfer(DataTransferredEvent e) {
        metrics.incrementTransfer(e.sourceNodeId());
    }

    @EventListener
    void onConnectionState(ConnectionStateChangedEvent e) {
        metrics.incrementConnectionState(e.nodeId(), e.currentState().name());
    }

    @EventListener
    void onTranscript(TranscriptionReceivedEvent e) {
        metrics.incrementTranscripts(e.nodeId(), e.isFinal());
    }
}
