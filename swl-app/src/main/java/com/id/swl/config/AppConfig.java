package com.id.swl.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class AppConfig {

    @Value("${swl.storage.min-pool-size:1}")
    private int storageMinPoolSize;

    @Value("${swl.storage.max-pool-size:10}")
    private int storageMaxPoolSize;

    // How long a request waits for a pooled connection before failing as unavailable
    @Value("${swl.storage.wait-queue-timeout-ms:5000}")
    private long storageWaitQueueTimeoutMs;

    @Value("${swl.storage.transactions-enabled:true}")
    private boolean storageTransactionsEnabled;

    // Attempts for a batch write failing with a transient error such as a write conflict
    @Value("${swl.storage.write-attempts:5}")
    private int storageWriteAttempts;

    @Value("${swl.storage.write-retry-backoff-ms:50}")
    private long storageWriteRetryBackoffMs;
}
