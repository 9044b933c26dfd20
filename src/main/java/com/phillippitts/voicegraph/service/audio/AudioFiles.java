package com.phillippitts.voicegraph.service.audio;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and saves headerless PCM files. The format is not stored in the file and must be
 * supplied by the caller.
 *
 * @since 1.0
 */
public final class AudioFiles {

    private static final Logger LOG = LogManager.getLogger(AudioFiles.class);

    private AudioFiles() {
        // Utility class
    }

    public static AudioBuffer loadRawPcm(Path path, AudioFormat format) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(format, "format");
        byte[] data = Files.readAllBytes(path);
        if (data.length % format.frameSize() != 0) {
            LOG.warn("File {} length {} is not a multiple of frame size {}", path, data.length, format.frameSize());
        }
        return new AudioBuffer(data, format);
    }

    public static void saveRawPcm(AudioBuffer buffer, Path path) throws IOException {
        Objects.requireNonNull(buffer, "buffer");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, buffer.rawData());
        LOG.debug("Saved {} to {}", buffer, path);
    }
}
