package com.id.swl.client.modules.ingest.model;

import lombok.Builder;

import java.nio.file.Path;

/**
 * @param batchSize  - Rows per request
 * @param sleepMs    - Pause after each request
 * @param maxBatches - Stop after this many requests, 0 for no limit
 */
@Builder
public record BulkLoadOptions(Path file,
                              String source,
                              String parameter,
                              int batchSize,
                              long sleepMs,
                              int maxBatches) {

    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final long DEFAULT_SLEEP_MS = 50;

    public BulkLoadOptions {
        if (file == null) {
            throw new IllegalArgumentException("CSV file is required");
        }
        if (source == null || source.isBlank() || parameter == null || parameter.isBlank()) {
            throw new IllegalArgumentException("Source and parameter cannot be null or blank");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got %d".formatted(batchSize));
        }
        if (sleepMs < 0 || maxBatches < 0) {
            throw new IllegalArgumentException("Sleep and max batches cannot be negative");
        }
    }
}
