package com.phillippitts.voicegraph.service.node.processor;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.exception.UnsupportedConversionException;
import com.phillippitts.voicegraph.service.audio.AudioConverter;
import com.phillippitts.voicegraph.service.node.AbstractProcessorNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Converts audio to a fixed target format. An unsupported pairing is logged to the context
 * and the input is forwarded unchanged.
 */
public class FormatConversionNode extends AbstractProcessorNode {

    private static final Logger LOG = LogManager.getLogger(FormatConversionNode.class);

    private volatile AudioFormat targetFormat;

    public FormatConversionNode(String id, String name) {
        this(id, name, AudioFormat.DEFAULT);
    }

    public FormatConversionNode(String id, String name, AudioFormat targetFormat) {
        super(id, name);
        setTargetFormat(targetFormat);
    }

    public AudioFormat getTargetFormat() {
        return targetFormat;
    }

    public void setTargetFormat(AudioFormat targetFormat) {
        this.targetFormat = Objects.requireNonNull(targetFormat, "targetFormat");
        setOutputFormat(targetFormat);
    }

    @Override
    protected AudioBuffer processAudio(AudioBuffer input, ProcessingContext context) {
        try {
            return AudioConverter.convert(input, targetFormat);
        } catch (UnsupportedConversionException e) {
            LOG.warn("Node '{}': {}", getId(), e.getMessage());
            if (context != null) {
                context.logWarning(e.getMessage());
            }
            return input;
        }
    }
}
