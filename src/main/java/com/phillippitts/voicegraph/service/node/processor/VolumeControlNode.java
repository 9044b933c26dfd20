package com.phillippitts.voicegraph.service.node.processor;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import com.phillippitts.voicegraph.domain.ProcessingContext;
import com.phillippitts.voicegraph.service.audio.PcmSamples;
import com.phillippitts.voicegraph.service.node.AbstractProcessorNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Scales every sample by a linear gain and clamps the result.
 *
 * <p>The gain lives in the {@code gain} configuration key so it survives persistence.
 * A gain within 0.001 of unity leaves the buffer untouched.
 */
public class VolumeControlNode extends AbstractProcessorNode {

    private static final Logger LOG = LogManager.getLogger(VolumeControlNode.class);

    public static final String CONFIG_GAIN = "gain";
    public static final String META_ORIGINAL_GAIN = "originalGain";

    private static final double UNITY_TOLERANCE = 0.001;

    public VolumeControlNode(String id, String name) {
        super(id, name);
    }

    public double getGain() {
        return getConfigurationNumber(CONFIG_GAIN, 1.0);
    }

    public void setGain(double gain) {
        if (gain < 0 || Double.isNaN(gain)) {
            throw new IllegalArgumentException("gain must be >= 0, got " + gain);
        }
        setConfigurationValue(CONFIG_GAIN, gain);
    }

    @Override
    protected AudioBuffer processAudio(AudioBuffer input, ProcessingContext context) {
        double gain = getGain();
        if (Math.abs(gain - 1.0) < UNITY_TOLERANCE) {
            return input;
        }
        AudioFormat format = input.format();
        if (!format.isPcm16() && !format.isFloat32()) {
            String message = "Volume control skipped for unsupported format " + format;
            LOG.warn(message);
            if (context != null) {
                context.logWarning(message);
            }
            return input;
        }

        byte[] data = input.rawData();
        if (format.isPcm16()) {
            for (int i = 0; i + 1 < data.length; i += 2) {
                PcmSamples.writeInt16(data, i, PcmSamples.clampInt16(PcmSamples.readInt16(data, i) * gain));
            }
        } else {
            for (int i = 0; i + 3 < data.length; i += 4) {
                PcmSamples.writeFloat32(data, i, PcmSamples.clampUnit(PcmSamples.readFloat32(data, i) * gain));
            }
        }
        AudioBuffer output = new AudioBuffer(data, format);
        output.metadata().putAll(input.metadata());
        output.metadata().put(META_ORIGINAL_GAIN, gain);
        return output;
    }
}
