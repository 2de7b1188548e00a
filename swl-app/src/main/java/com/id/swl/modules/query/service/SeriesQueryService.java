package com.id.swl.modules.query.service;

import com.id.swl.model.SwlMeasurement;
import com.id.swl.model.SwlQueryReq;
import com.id.swl.model.enums.SwlSeries;
import com.id.swl.modules.storage.service.MeasurementStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class SeriesQueryService {

    private final MeasurementStore measurementStore;

    public SeriesQueryService(MeasurementStore measurementStore) {
        this.measurementStore = measurementStore;
    }

    /**
     * Reads the selected series over the closed interval [start, end], ascending by time.
     * The caller bounds the interval; no paging is applied.
     */
    public List<SwlMeasurement> find(SwlQueryReq req) {
        SwlSeries series = Optional.ofNullable(req.getSeries()).orElse(SwlSeries.RAW);
        List<SwlMeasurement> rows = measurementStore.findRange(
                series,
                req.getSource(),
                req.getParameter(),
                req.getStart(),
                req.getEnd()
        );
        log.trace("Query %s/%s %s [%s, %s] returned %d rows".formatted(
                req.getSource(), req.getParameter(), series.code(), req.getStart(), req.getEnd(), rows.size()));
        return rows;
    }
}
