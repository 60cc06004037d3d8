package com.momoledger.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * SMS ingestion config: archive location, batch size, report and unprocessed-log files.
 */
@ConfigurationProperties(prefix = "momoledger.ingestion")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IngestionProperties {

    /** SMS Backup &amp; Restore XML export to ingest. */
    @NotBlank
    private String archivePath = "data/modified_sms_v2.xml";

    /** Messages saved concurrently per batch; batches run one after another. */
    @Min(1)
    private int batchSize = 50;

    /** JSON run report, overwritten on every run. */
    @NotBlank
    private String reportPath = "logs/processing-stats.json";

    /** Read by logback-spring.xml for the unprocessed-message appender. */
    @NotBlank
    private String unprocessedLogPath = "logs/unprocessed.log";

    /** Ingest the archive on startup when the transactions collection is empty. */
    private boolean runOnStartup = true;
}
