package com.phillippitts.voicegraph.service.node.io;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.node.AbstractNode;
import com.phillippitts.voicegraph.service.node.AudioInputCapable;
import com.phillippitts.voicegraph.service.node.AudioOutputCapable;

import java.time.Duration;
import java.util.List;

/**
 * Sink that keeps the last buffer it received and exposes it as pipeline output.
 *
 * <p>Receives audio only through connections: it is not an entry point. Its output format
 * follows the last buffer received.
 */
public class RawPcmOutputNode extends AbstractNode implements AudioInputCapable, AudioOutputCapable {

    private volatile AudioBuffer lastAudio;
    private volatile AudioFormat outputFormat = AudioFormat.DEFAULT;

    public RawPcmOutputNode(String id, String name) {
        super(id, name);
    }

    @Override
    public List<AudioFormat> getSupportedFormats() {
        return List.of();
    }

    @Override
    public boolean isEntryPoint() {
        return false;
    }

    @Override
    public boolean acceptAudio(AudioBuffer buffer, ProcessingContext context) {
        if (!isEnabled() || buffer == null) {
            return false;
        }
        if (context != null && context.isCancellationRequested()) {
            return false;
        }
        lastAudio = buffer;
        outputFormat = buffer.format();
        trackProcessing(Duration.ZERO);
        return true;
    }

    @Override
    public AudioFormat getOutputFormat() {
        return outputFormat;
    }

    @Override
    public AudioBuffer pullAudioOutput(ProcessingContext context) {
        return lastAudio;
    }

    @Override
    protected void doReset() {
        lastAudio = null;
    }
}
