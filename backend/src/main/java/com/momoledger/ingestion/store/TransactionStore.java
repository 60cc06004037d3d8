package com.momoledger.ingestion.store;

import com.momoledger.domain.MomoTransaction;

/**
 * Persistence contract used by the ingestion job. Inserts only: saving the same message twice stores it twice.
 */
public interface TransactionStore {

    /**
     * @return true when the transaction was persisted, false when the store declined it
     * @throws RuntimeException on a persistence error
     */
    boolean save(MomoTransaction transaction);

    long count();
}
