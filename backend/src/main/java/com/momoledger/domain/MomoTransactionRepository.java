package com.momoledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for the transactions collection.
 */
public interface MomoTransactionRepository extends MongoRepository<MomoTransaction, String> {
}
