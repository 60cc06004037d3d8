package com.momoledger.domain;

import lombok.Getter;

import java.time.Instant;

/**
 * Outcome counters of one ingestion run. One instance per run; mutated only by the ingestion job.
 * {@code processedCount + ignoredCount == totalMessages} once the run is finished.
 */
@Getter
public class IngestionRunSummary {

    private final int totalMessages;
    private int processedCount;
    private int ignoredCount;
    private Instant timestamp;

    public IngestionRunSummary(int totalMessages) {
        if (totalMessages < 0) {
            throw new IllegalArgumentException("totalMessages must be >= 0: " + totalMessages);
        }
        this.totalMessages = totalMessages;
    }

    public void addBatch(int processed, int ignored) {
        if (processedCount + ignoredCount + processed + ignored > totalMessages) {
            throw new IllegalStateException("Batch counts exceed archive size " + totalMessages);
        }
        processedCount += processed;
        ignoredCount += ignored;
    }

    public int getHandledCount() {
        return processedCount + ignoredCount;
    }

    public void finish(Instant finishedAt) {
        if (getHandledCount() != totalMessages) {
            throw new IllegalStateException("Run finished with " + getHandledCount()
                    + " of " + totalMessages + " messages handled");
        }
        this.timestamp = finishedAt;
    }

    public boolean isFinished() {
        return timestamp != null;
    }
}
