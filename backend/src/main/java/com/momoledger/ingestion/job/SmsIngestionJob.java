package com.momoledger.ingestion.job;

import com.momoledger.domain.IngestionRunSummary;
import com.momoledger.domain.MomoTransaction;
import com.momoledger.domain.RawSms;
import com.momoledger.ingestion.archive.SmsArchiveReader;
import com.momoledger.ingestion.config.IngestionProperties;
import com.momoledger.ingestion.normalizer.MomoTransactionBuilder;
import com.momoledger.ingestion.store.TransactionStore;
import com.momoledger.ingestion.unprocessed.UnprocessedMessageLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ingests an SMS archive: read → fixed-size batches → per message build + save on the ingestion executor → report.
 * Batches run one after another; messages inside a batch are saved concurrently. A failing message is logged to
 * the {@link UnprocessedMessageLog} and counted as ignored; only an unreadable archive aborts the run.
 * Not idempotent: run it against an empty store.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SmsIngestionJob {

    static final String SAVE_DECLINED = "Failed to create transaction";

    private record BatchOutcome(int processed, int ignored) {}

    private final SmsArchiveReader smsArchiveReader;
    private final MomoTransactionBuilder momoTransactionBuilder;
    private final TransactionStore transactionStore;
    private final UnprocessedMessageLog unprocessedMessageLog;
    private final IngestionReportWriter ingestionReportWriter;
    private final IngestionProperties ingestionProperties;
    private final Clock clock;
    @Qualifier("ingestion-executor")
    private final Executor ingestionExecutor;

    public IngestionRunSummary run() {
        return run(Path.of(ingestionProperties.getArchivePath()));
    }

    /**
     * @throws com.momoledger.ingestion.archive.ArchiveReadException if the archive cannot be read; nothing is persisted then
     */
    public IngestionRunSummary run(Path archive) {
        List<RawSms> messages = smsArchiveReader.read(archive);
        int total = messages.size();
        int batchSize = Math.max(1, ingestionProperties.getBatchSize());
        IngestionRunSummary summary = new IngestionRunSummary(total);

        for (int from = 0; from < total; from += batchSize) {
            List<RawSms> batch = messages.subList(from, Math.min(from + batchSize, total));
            BatchOutcome outcome = processBatch(batch);
            summary.addBatch(outcome.processed(), outcome.ignored());
            log.info("Processed {} of {} messages...", from + batch.size(), total);
        }

        summary.finish(clock.instant());
        log.info("SMS processing complete. Processed: {}, Ignored: {}",
                summary.getProcessedCount(), summary.getIgnoredCount());
        ingestionReportWriter.write(summary, Path.of(ingestionProperties.getReportPath()));
        return summary;
    }

    private BatchOutcome processBatch(List<RawSms> batch) {
        List<CompletableFuture<Boolean>> futures = new ArrayList<>(batch.size());
        for (RawSms sms : batch) {
            futures.add(submit(sms));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        int processed = 0;
        for (CompletableFuture<Boolean> f : futures) {
            if (Boolean.TRUE.equals(f.join())) {
                processed++;
            }
        }
        return new BatchOutcome(processed, batch.size() - processed);
    }

    private CompletableFuture<Boolean> submit(RawSms sms) {
        try {
            return CompletableFuture.supplyAsync(() -> processMessage(sms), ingestionExecutor)
                    .exceptionally(e -> {
                        unprocessedMessageLog.log(sms, describe(unwrap(e)));
                        return false;
                    });
        } catch (RejectedExecutionException e) {
            unprocessedMessageLog.log(sms, describe(e));
            return CompletableFuture.completedFuture(false);
        }
    }

    /** Build and save one message; true when persisted. */
    boolean processMessage(RawSms sms) {
        try {
            MomoTransaction tx = momoTransactionBuilder.build(sms);
            if (transactionStore.save(tx)) {
                return true;
            }
            unprocessedMessageLog.log(sms, SAVE_DECLINED);
            return false;
        } catch (Exception e) {
            log.debug("Message from {} not ingested: {}", sms.getAddress(), e.getMessage());
            unprocessedMessageLog.log(sms, describe(e));
            return false;
        }
    }

    private static Throwable unwrap(Throwable e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
