package com.momoledger.ingestion.store;

import com.momoledger.domain.MomoTransaction;
import com.momoledger.domain.MomoTransactionRepository;
import com.momoledger.domain.TransactionCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoTransactionStoreTest {

    @Mock
    private MomoTransactionRepository repository;

    @InjectMocks
    private MongoTransactionStore store;

    @Test
    void insertsAndReportsSuccess() {
        MomoTransaction tx = new MomoTransaction();
        tx.setCategory(TransactionCategory.OTHER);
        when(repository.insert(tx)).thenAnswer(inv -> {
            MomoTransaction saved = inv.getArgument(0);
            saved.setId("abc");
            return saved;
        });

        assertThat(store.save(tx)).isTrue();
    }

    @Test
    void declinesWithoutCategory() {
        assertThat(store.save(new MomoTransaction())).isFalse();
        assertThat(store.save(null)).isFalse();
        verify(repository, never()).insert(any(MomoTransaction.class));
    }

    @Test
    void persistenceErrorPropagates() {
        MomoTransaction tx = new MomoTransaction();
        tx.setCategory(TransactionCategory.OTHER);
        when(repository.insert(tx)).thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> store.save(tx)).isInstanceOf(IllegalStateException.class);
    }
}
