package com.momoledger.ingestion.store;

import com.momoledger.domain.MomoTransaction;
import com.momoledger.domain.MomoTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * {@link TransactionStore} over the transactions collection. Always inserts a new document.
 */
@Service
@RequiredArgsConstructor
public class MongoTransactionStore implements TransactionStore {

    private final MomoTransactionRepository repository;

    @Override
    public boolean save(MomoTransaction transaction) {
        if (transaction == null || transaction.getCategory() == null) {
            return false;
        }
        MomoTransaction saved = repository.insert(transaction);
        return saved != null && saved.getId() != null;
    }

    @Override
    public long count() {
        return repository.count();
    }
}
