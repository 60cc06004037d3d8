package com.momoledger.ingestion.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.momoledger.domain.IngestionRunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the run report (ignored, processed, total, timestamp) as pretty-printed JSON, replacing any previous report.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionReportWriter {

    private final ObjectMapper objectMapper;

    public ProcessingStatsReport write(IngestionRunSummary summary, Path reportPath) {
        ProcessingStatsReport report = ProcessingStatsReport.from(summary);
        try {
            Path parent = reportPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(reportPath.toFile(), report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write ingestion report " + reportPath, e);
        }
        log.debug("Ingestion report written to {}", reportPath);
        return report;
    }
}
