package com.id.swl.modules.storage.service;

import com.id.swl.config.AppConfig;
import com.id.swl.exceptions.StorageUnavailableException;
import com.id.swl.model.SwlMeasurement;
import com.id.swl.model.enums.SwlSeries;
import com.id.swl.modules.storage.model.MeasurementEntity;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.BulkOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * Pooled access to the two measurement collections. Every write is an upsert on
 * (source, parameter, time), so resubmitting a batch converges to the same rows.
 */
@Service
@Slf4j
public class MeasurementStore {

    public static final String RAW_COLLECTION = "raw_measurements";
    public static final String MIN1_COLLECTION = "min1_measurements";

    private final MongoTemplate mongoTemplate;
    private final TransactionOperations transactions;
    private final int writeAttempts;
    private final long writeRetryBackoffMs;

    public MeasurementStore(AppConfig appConfig,
                            MongoTemplate mongoTemplate,
                            ObjectProvider<PlatformTransactionManager> transactionManager) {
        this.mongoTemplate = mongoTemplate;
        this.writeAttempts = Math.max(1, appConfig.getStorageWriteAttempts());
        this.writeRetryBackoffMs = Math.max(0, appConfig.getStorageWriteRetryBackoffMs());

        PlatformTransactionManager txManager = transactionManager.getIfAvailable();
        if (appConfig.isStorageTransactionsEnabled() && txManager != null) {
            this.transactions = new TransactionTemplate(txManager);
        } else {
            // Each bulk is still one round trip, but a failure halfway leaves the rows written so far
            log.warn("Storage transactions disabled: a failed batch write may be partially applied until retried");
            this.transactions = TransactionOperations.withoutTransaction();
        }
    }

    @PostConstruct
    public void ensureIndexes() {
        for (SwlSeries series : SwlSeries.values()) {
            String collectionName = collectionName(series);
            mongoTemplate.indexOps(collectionName).ensureIndex(new Index()
                    .on(MeasurementEntity.SOURCE, Sort.Direction.ASC)
                    .on(MeasurementEntity.PARAMETER, Sort.Direction.ASC)
                    .on(MeasurementEntity.TS_MICROS, Sort.Direction.ASC)
                    .unique()
                    .named(MeasurementEntity.KEY_IDX));
            log.debug("Ensured key index on %s".formatted(collectionName));
        }
    }

    public static String collectionName(SwlSeries series) {
        return switch (series) {
            case RAW -> RAW_COLLECTION;
            case MIN1 -> MIN1_COLLECTION;
        };
    }

    /**
     * Upserts the rows into the collection of the given series, all or nothing.
     * Rows sharing a key are applied in list order, so the last one wins. A transaction
     * aborted by a transient error, typically a write conflict with a concurrent batch on
     * the same keys, is retried as a whole up to the configured number of attempts.
     *
     * @return Number of rows submitted
     */
    public int upsert(SwlSeries series, List<SwlMeasurement> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        String collectionName = collectionName(series);

        return guarded("upsert %d rows into %s".formatted(rows.size(), collectionName), () ->
                withTransientRetry(collectionName, () -> transactions.execute(status -> {
                    BulkOperations bulk = mongoTemplate.bulkOps(BulkOperations.BulkMode.ORDERED, MeasurementEntity.class, collectionName);
                    for (SwlMeasurement row : rows) {
                        long tsMicros = MeasurementEntity.toMicros(row.getTime());
                        Update update = new Update()
                                .set(MeasurementEntity.VALUE, row.getValue())
                                .set(MeasurementEntity.QUALITY, row.getQuality())
                                .setOnInsert(MeasurementEntity.SOURCE, row.getSource())
                                .setOnInsert(MeasurementEntity.PARAMETER, row.getParameter())
                                .setOnInsert(MeasurementEntity.TS_MICROS, tsMicros);
                        bulk.upsert(query(keyCriteria(row.getSource(), row.getParameter(), tsMicros)), update);
                    }
                    bulk.execute();
                    return rows.size();
                })));
    }

    /**
     * Rows of one (source, parameter) with time in [start, end], ascending by time.
     */
    public List<SwlMeasurement> findRange(SwlSeries series, String source, String parameter, Instant start, Instant end) {
        String collectionName = collectionName(series);

        Query query = query(where(MeasurementEntity.SOURCE).is(source)
                .and(MeasurementEntity.PARAMETER).is(parameter)
                .and(MeasurementEntity.TS_MICROS).gte(ceilMicros(start)).lte(MeasurementEntity.toMicros(end)))
                .with(Sort.by(Sort.Direction.ASC, MeasurementEntity.TS_MICROS));

        return guarded("read range from %s".formatted(collectionName), () ->
                mongoTemplate.find(query, MeasurementEntity.class, collectionName).stream()
                        .map(MeasurementStore::toModel)
                        .toList());
    }

    private static Criteria keyCriteria(String source, String parameter, long tsMicros) {
        return new Criteria().andOperator(
                where(MeasurementEntity.SOURCE).is(source),
                where(MeasurementEntity.PARAMETER).is(parameter),
                where(MeasurementEntity.TS_MICROS).is(tsMicros)
        );
    }

    private static long ceilMicros(Instant t) {
        long micros = MeasurementEntity.toMicros(t);
        return t.getNano() % 1_000 == 0 ? micros : micros + 1;
    }

    private static SwlMeasurement toModel(MeasurementEntity entity) {
        return SwlMeasurement.builder()
                .time(MeasurementEntity.toInstant(entity.getTsMicros()))
                .source(entity.getSource())
                .parameter(entity.getParameter())
                .value(entity.getValue())
                .quality(entity.getQuality())
                .build();
    }

    private <T> T withTransientRetry(String collectionName, Supplier<T> write) {
        for (int attempt = 1; ; attempt++) {
            try {
                return write.get();
            } catch (TransientDataAccessException ex) {
                if (attempt >= writeAttempts) {
                    throw ex;
                }
                log.debug("Transient failure writing %s, attempt %d/%d: %s".formatted(
                        collectionName, attempt, writeAttempts, ex.getMessage()));
                backOff(attempt);
            }
        }
    }

    private void backOff(int attempt) {
        if (writeRetryBackoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(writeRetryBackoffMs * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrupted while retrying a storage write", e);
        }
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException | TransactionException ex) {
            log.warn("Storage unavailable, failed to %s: %s".formatted(operation, ex.getMessage()));
            throw new StorageUnavailableException("Storage unavailable, failed to " + operation, ex);
        }
    }
}
