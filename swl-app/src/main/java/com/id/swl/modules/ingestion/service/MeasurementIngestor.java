package com.id.swl.modules.ingestion.service;

import com.id.swl.exceptions.HeterogeneousBatchException;
import com.id.swl.exceptions.MalformedMeasurementException;
import com.id.swl.model.SwlMeasurement;
import com.id.swl.model.enums.SwlSeries;
import com.id.swl.modules.ingestion.model.IngestionResult;
import com.id.swl.modules.ingestion.model.MinuteSeriesMode;
import com.id.swl.modules.regularization.logic.LinearResampler;
import com.id.swl.modules.regularization.logic.RegularityClassifier;
import com.id.swl.modules.regularization.model.TimedValue;
import com.id.swl.modules.storage.service.MeasurementStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

@Service
@Slf4j
public class MeasurementIngestor {

    private final MeasurementStore measurementStore;

    public MeasurementIngestor(MeasurementStore measurementStore) {
        this.measurementStore = measurementStore;
    }

    /**
     * Stores a batch of one (source, parameter) into the raw collection verbatim, then
     * derives and stores its min1 series.
     * <p>
     * The two writes are separate transactions. When the min1 write fails after the raw
     * one committed, resubmitting the same batch is safe.
     *
     * @param batch - Measurements sharing one source and one parameter
     *
     * @return Rows submitted to each collection
     */
    public IngestionResult ingest(List<SwlMeasurement> batch) {
        if (batch == null || batch.isEmpty()) {
            return IngestionResult.empty();
        }

        // Validate everything before the first write
        batch.forEach(MeasurementIngestor::checkWellFormed);
        String source = batch.get(0).getSource();
        String parameter = batch.get(0).getParameter();
        checkHomogeneous(batch, source, parameter);

        List<SwlMeasurement> rawRows = batch.stream().map(MeasurementIngestor::toRawRow).toList();
        int storedRaw = measurementStore.upsert(SwlSeries.RAW, rawRows);

        List<TimedValue> points = rawRows.stream()
                .map(m -> new TimedValue(m.getTime(), m.getValue()))
                .toList();
        Instant start = points.stream().map(TimedValue::time).min(Comparator.naturalOrder()).orElseThrow();
        Instant end = points.stream().map(TimedValue::time).max(Comparator.naturalOrder()).orElseThrow();

        MinuteSeriesMode mode;
        List<TimedValue> minutePoints;
        if (RegularityClassifier.isRegularMinuteSeries(points) && points.stream().allMatch(TimedValue::isFinite)) {
            mode = MinuteSeriesMode.PASS_THROUGH;
            minutePoints = points;
        } else {
            minutePoints = LinearResampler.resampleToMinute(points, start, end);
            mode = minutePoints.isEmpty() ? MinuteSeriesMode.INSUFFICIENT_SAMPLES : MinuteSeriesMode.RESAMPLED;
        }

        if (mode == MinuteSeriesMode.INSUFFICIENT_SAMPLES) {
            log.warn("Fewer than two finite points for %s/%s in [%s, %s]: no min1 rows written".formatted(
                    source, parameter, start, end));
        }

        List<SwlMeasurement> minuteRows = minutePoints.stream()
                .map(p -> SwlMeasurement.builder()
                        .time(p.time())
                        .source(source)
                        .parameter(parameter)
                        .value(p.value())
                        .build())
                .toList();
        int storedMin1 = measurementStore.upsert(SwlSeries.MIN1, minuteRows);

        log.info("Ingested %s/%s [%s, %s]: raw=%d, min1=%d (%s)".formatted(
                source, parameter, start, end, storedRaw, storedMin1, mode));
        return new IngestionResult(storedRaw, storedMin1, mode);
    }

    private static void checkWellFormed(SwlMeasurement m) {
        if (m == null) {
            throw new MalformedMeasurementException("Measurement cannot be null");
        }
        if (m.getTime() == null) {
            throw new MalformedMeasurementException("Measurement time cannot be null");
        }
        if (m.getSource() == null || m.getSource().isBlank()) {
            throw new MalformedMeasurementException("Measurement source cannot be null or blank");
        }
        if (m.getParameter() == null || m.getParameter().isBlank()) {
            throw new MalformedMeasurementException("Measurement parameter cannot be null or blank");
        }
        if (m.getValue() == null) {
            throw new MalformedMeasurementException("Measurement value cannot be null");
        }
    }

    private static void checkHomogeneous(List<SwlMeasurement> batch, String source, String parameter) {
        for (SwlMeasurement m : batch) {
            if (!source.equals(m.getSource()) || !parameter.equals(m.getParameter())) {
                throw new HeterogeneousBatchException(
                        "A batch must carry a single source and parameter, found %s/%s and %s/%s".formatted(
                                source, parameter, m.getSource(), m.getParameter()));
            }
        }
    }

    // Storage keeps microseconds
    private static SwlMeasurement toRawRow(SwlMeasurement m) {
        return SwlMeasurement.builder()
                .time(m.getTime().truncatedTo(ChronoUnit.MICROS))
                .source(m.getSource())
                .parameter(m.getParameter())
                .value(m.getValue())
                .quality(m.getQuality())
                .build();
    }
}
