package com.momoledger.ingestion.job;

import com.momoledger.domain.IngestionRunSummary;
import com.momoledger.ingestion.archive.ArchiveReadException;
import com.momoledger.ingestion.config.IngestionProperties;
import com.momoledger.ingestion.store.TransactionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DatabasePopulatorTest {

    @Mock
    private TransactionStore transactionStore;
    @Mock
    private SmsIngestionJob smsIngestionJob;

    private IngestionProperties properties;
    private DatabasePopulator populator;

    @BeforeEach
    void setUp() {
        properties = new IngestionProperties();
        populator = new DatabasePopulator(transactionStore, smsIngestionJob, properties);
    }

    @Test
    @DisplayName("populated database: ingestion is skipped")
    void skipsWhenNotEmpty() {
        when(transactionStore.count()).thenReturn(12L);

        assertThat(populator.populateIfEmpty()).isEmpty();
        verify(smsIngestionJob, never()).run();
    }

    @Test
    void runsWhenEmpty() {
        IngestionRunSummary summary = new IngestionRunSummary(0);
        summary.finish(Instant.EPOCH);
        when(transactionStore.count()).thenReturn(0L);
        when(smsIngestionJob.run()).thenReturn(summary);

        assertThat(populator.populateIfEmpty()).containsSame(summary);
    }

    @Test
    void onApplicationReady_respectsRunOnStartup() {
        properties.setRunOnStartup(false);

        populator.onApplicationReady();

        verify(transactionStore, never()).count();
        verify(smsIngestionJob, never()).run();
    }

    @Test
    void onApplicationReady_propagatesArchiveFailure() {
        when(transactionStore.count()).thenReturn(0L);
        when(smsIngestionJob.run()).thenThrow(new ArchiveReadException("SMS archive not found: data/x.xml"));

        assertThatThrownBy(populator::onApplicationReady).isInstanceOf(ArchiveReadException.class);
    }
}
