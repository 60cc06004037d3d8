package com.momoledger.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IngestionRunSummaryTest {

    @Test
    void accumulatesBatchesAndFinishes() {
        IngestionRunSummary summary = new IngestionRunSummary(120);

        summary.addBatch(48, 2);
        summary.addBatch(50, 0);
        summary.addBatch(19, 1);
        summary.finish(Instant.parse("2025-01-15T12:00:00Z"));

        assertThat(summary.getProcessedCount()).isEqualTo(117);
        assertThat(summary.getIgnoredCount()).isEqualTo(3);
        assertThat(summary.getHandledCount()).isEqualTo(120);
        assertThat(summary.isFinished()).isTrue();
    }

    @Test
    void cannotFinishEarly() {
        IngestionRunSummary summary = new IngestionRunSummary(10);
        summary.addBatch(5, 0);

        assertThatThrownBy(() -> summary.finish(Instant.EPOCH)).isInstanceOf(IllegalStateException.class);
        assertThat(summary.isFinished()).isFalse();
    }

    @Test
    void cannotExceedTotal() {
        IngestionRunSummary summary = new IngestionRunSummary(3);

        assertThatThrownBy(() -> summary.addBatch(3, 1)).isInstanceOf(IllegalStateException.class);
        assertThat(summary.getHandledCount()).isZero();
    }

    @Test
    void negativeTotal_rejected() {
        assertThatThrownBy(() -> new IngestionRunSummary(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
