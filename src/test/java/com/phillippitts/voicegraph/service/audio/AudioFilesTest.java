package com.phillippitts.voicegraph.service.audio;

import com.phillippitts.voicegraph.domain.AudioBuffer;
import com.phillippitts.voicegraph.domain.AudioFormat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void savedPcmLoadsBackWithGivenFormat() throws IOException {
        AudioBuffer buffer = new AudioBuffer(new byte[]{1, 2, 3, 4}, AudioFormat.DEFAULT);
        Path file = tempDir.resolve("nested").resolve("clip.pcm");

        AudioFiles.saveRawPcm(buffer, file);
        AudioBuffer loaded = AudioFiles.loadRawPcm(file, AudioFormat.DEFAULT);

        assertThat(Files.size(file)).isEqualTo(4);
        assertThat(loaded.contentEquals(buffer)).isTrue();
    }

    @Test
    void missingFileFails() {
        assertThatThrownBy(() -> AudioFiles.loadRawPcm(tempDir.resolve("absent.pcm"), AudioFormat.DEFAULT))
                .isInstanceOf(IOException.class);
    }
}
