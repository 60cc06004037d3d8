package com.momoledger.ingestion.job;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.momoledger.domain.IngestionRunSummary;

import java.time.format.DateTimeFormatter;

/**
 * JSON shape of the run report file.
 */
@JsonPropertyOrder({"ignored", "processed", "total", "timestamp"})
public record ProcessingStatsReport(int ignored, int processed, int total, String timestamp) {

    public static ProcessingStatsReport from(IngestionRunSummary summary) {
        return new ProcessingStatsReport(
                summary.getIgnoredCount(),
                summary.getProcessedCount(),
                summary.getTotalMessages(),
                summary.isFinished() ? DateTimeFormatter.ISO_INSTANT.format(summary.getTimestamp()) : null);
    }
}
