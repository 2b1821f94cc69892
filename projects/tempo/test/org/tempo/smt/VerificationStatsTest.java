package org.tempo.smt;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

public class VerificationStatsTest {

    @Test
    public void summarizesTimes() {
        VerificationStats stats = VerificationStats.fromTimes(4, 6, Arrays.asList(40L, 10L, 30L, 20L));
        assertThat(stats.getNumNodes()).isEqualTo(4);
        assertThat(stats.getNumEdges()).isEqualTo(6);
        assertThat(stats.getTotalTime()).isEqualTo(100L);
        assertThat(stats.getMinTime()).isEqualTo(10L);
        assertThat(stats.getMaxTime()).isEqualTo(40L);
        assertThat(stats.getMeanTime()).isEqualTo(25.0);
        assertThat(stats.getMedianTime()).isEqualTo(25.0);
    }

    @Test
    public void oddCountMedian() {
        VerificationStats stats = VerificationStats.fromTimes(3, 2, Arrays.asList(5L, 1L, 9L));
        assertThat(stats.getMedianTime()).isEqualTo(5.0);
    }

    @Test
    public void noTimes() {
        VerificationStats stats = VerificationStats.fromTimes(0, 0, Collections.emptyList());
        assertThat(stats.getTotalTime()).isZero();
        assertThat(stats.getMedianTime()).isZero();
    }
}
