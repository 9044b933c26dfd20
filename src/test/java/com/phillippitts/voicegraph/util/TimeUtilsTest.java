package com.phillippitts.voicegraph.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void shouldMeasureElapsedTime() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(5);

        assertThat(TimeUtils.elapsedSince(start)).isGreaterThanOrEqualTo(Duration.ofMillis(5));
    }

    @Test
    void futureStartClampsToZero() {
        assertThat(TimeUtils.elapsedSince(System.nanoTime() + 1_000_000_000L)).isEqualTo(Duration.ZERO);
    }
}
