package com.momoledger.config;

import com.momoledger.domain.TransactionCategory;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

/**
 * Reads a stored category label back; unrecognised labels map to {@link TransactionCategory#UNKNOWN}.
 */
@ReadingConverter
public class LabelToTransactionCategoryConverter implements Converter<String, TransactionCategory> {

    @Override
    public TransactionCategory convert(String source) {
        return TransactionCategory.fromLabel(source).orElse(TransactionCategory.UNKNOWN);
    }
}
