package com.id.swl.client.modules.ingest.service;

import com.id.swl.client.modules.api.service.SwlApiClient;
import com.id.swl.client.modules.ingest.logic.CsvMeasurementReader;
import com.id.swl.client.modules.ingest.model.BulkLoadOptions;
import com.id.swl.client.modules.ingest.model.BulkLoadResult;
import com.id.swl.model.SwlIngestRes;
import com.id.swl.model.SwlMeasurement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

@Service
@Slf4j
public class BulkLoader {

    private final SwlApiClient apiClient;

    public BulkLoader(SwlApiClient apiClient) {
        this.apiClient = apiClient;
    }

    /**
     * Posts the CSV rows in fixed-size batches, one request at a time, pausing between requests.
     *
     * @return Totals over all posted batches
     */
    public BulkLoadResult load(BulkLoadOptions options) throws IOException {
        long startNanos = System.nanoTime();
        long rows = 0;
        long raw = 0;
        long min1 = 0;
        int batches = 0;

        try (CsvMeasurementReader reader = CsvMeasurementReader.open(options.file(), options.source(), options.parameter())) {
            log.info("Loading %s (value column '%s') as %s/%s".formatted(
                    options.file(), reader.getValueColumn(), options.source(), options.parameter()));

            List<SwlMeasurement> batch;
            while (!(batch = reader.nextBatch(options.batchSize())).isEmpty()) {
                SwlIngestRes res = apiClient.ingest(batch);
                batches++;
                rows += batch.size();
                raw += res.getStoredRaw();
                min1 += res.getStoredMin1();
                log.debug("Batch %d: %d rows, raw=%d, min1=%d".formatted(
                        batches, batch.size(), res.getStoredRaw(), res.getStoredMin1()));

                pause(options.sleepMs());
                if (options.maxBatches() > 0 && batches >= options.maxBatches()) {
                    log.info("Stopping after %d batches".formatted(batches));
                    break;
                }
            }

            if (reader.getSkippedRows() > 0) {
                log.info("Skipped %d unparsable rows".formatted(reader.getSkippedRows()));
            }
        }

        long elapsedS = Duration.ofNanos(System.nanoTime() - startNanos).toSeconds();
        return new BulkLoadResult(rows, raw, min1, elapsedS);
    }

    private static void pause(long sleepMs) {
        if (sleepMs <= 0) {
            return;
        }
        try {
            Thread.sleep(sleepMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while pacing batches", e);
        }
    }
}
