package com.momoledger.ingestion.archive;

/**
 * The SMS archive is missing or cannot be parsed into messages. Aborts the whole ingestion run.
 */
public class ArchiveReadException extends RuntimeException {

    public ArchiveReadException(String message, Throwable cause) {
        super(message, cause);
    }

    public ArchiveReadException(String message) {
        super(message);
    }
}
