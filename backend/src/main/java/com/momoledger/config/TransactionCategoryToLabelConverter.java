package com.momoledger.config;

import com.momoledger.domain.TransactionCategory;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

@WritingConverter
public class TransactionCategoryToLabelConverter implements Converter<TransactionCategory, String> {

    @Override
    public String convert(TransactionCategory source) {
        return source.getLabel();
    }
}
