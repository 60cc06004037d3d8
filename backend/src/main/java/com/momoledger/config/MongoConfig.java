package com.momoledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;

import java.util.Arrays;

/**
 * MongoDB configuration: categories are stored by display label ("Incoming Money"), not enum name.
 */
@Configuration
public class MongoConfig {

    @Bean
    public MongoCustomConversions customConversions() {
        return new MongoCustomConversions(Arrays.asList(
                new TransactionCategoryToLabelConverter(),
                new LabelToTransactionCategoryConverter()
        ));
    }
}
