package com.momoledger.ingestion.job;

import com.momoledger.domain.IngestionRunSummary;
import com.momoledger.ingestion.config.IngestionProperties;
import com.momoledger.ingestion.store.TransactionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Seeds the transactions collection from the SMS archive on startup, but only while it is empty.
 * An unreadable archive propagates and stops the application.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DatabasePopulator {

    private final TransactionStore transactionStore;
    private final SmsIngestionJob smsIngestionJob;
    private final IngestionProperties ingestionProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!ingestionProperties.isRunOnStartup()) {
            log.debug("Startup SMS ingestion disabled");
            return;
        }
        populateIfEmpty();
    }

    public Optional<IngestionRunSummary> populateIfEmpty() {
        long existing = transactionStore.count();
        if (existing > 0) {
            log.info("Database already contains {} transactions, skipping SMS ingestion", existing);
            return Optional.empty();
        }
        log.info("No transactions found in database. Processing SMS archive {}", ingestionProperties.getArchivePath());
        IngestionRunSummary summary = smsIngestionJob.run();
        log.info("Database initialized with SMS data: {} transaction(s)", summary.getProcessedCount());
        return Optional.of(summary);
    }
}
