package com.momoledger.ingestion.unprocessed;

import com.momoledger.domain.RawSms;

/**
 * Append-only sink for messages the ingestion job could not persist. Safe for concurrent callers; never throws.
 */
public interface UnprocessedMessageLog {

    void log(RawSms sms, String reason);
}
