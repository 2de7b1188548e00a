package com.id.swl.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.mongo.MongoClientSettingsBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;

import java.util.concurrent.TimeUnit;

@Configuration
@Slf4j
public class MongoConfig {

    @Bean
    public MongoClientSettingsBuilderCustomizer swlConnectionPoolCustomizer(AppConfig appConfig) {
        log.info("Storage pool: min=%d, max=%d, waitQueueTimeout=%dms".formatted(
                appConfig.getStorageMinPoolSize(),
                appConfig.getStorageMaxPoolSize(),
                appConfig.getStorageWaitQueueTimeoutMs()));
        return builder -> builder.applyToConnectionPoolSettings(pool -> pool
                .minSize(appConfig.getStorageMinPoolSize())
                .maxSize(appConfig.getStorageMaxPoolSize())
                .maxWaitTime(appConfig.getStorageWaitQueueTimeoutMs(), TimeUnit.MILLISECONDS));
    }

    /**
     * Multi-document transactions need a replica set. Standalone servers must run with
     * {@code swl.storage.transactions-enabled=false}.
     */
    @Bean
    @ConditionalOnProperty(name = "swl.storage.transactions-enabled", havingValue = "true", matchIfMissing = true)
    public MongoTransactionManager transactionManager(MongoDatabaseFactory dbFactory) {
        return new MongoTransactionManager(dbFactory);
    }
}
