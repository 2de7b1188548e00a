package com.id.swl.modules.ingestion.rest;

import com.id.swl.exceptions.StorageUnavailableException;
import com.id.swl.model.SwlIngestRes;
import com.id.swl.model.SwlMeasurement;
import com.id.swl.modules.ingestion.service.MeasurementIngestor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("v1")
public class IngestRest {

    private final MeasurementIngestor measurementIngestor;

    public IngestRest(MeasurementIngestor measurementIngestor) {
        this.measurementIngestor = measurementIngestor;
    }

    @PostMapping("ingest")
    public ResponseEntity<SwlIngestRes> ingest(@RequestBody List<SwlMeasurement> measurements) {
        try {
            return ResponseEntity.ok(measurementIngestor.ingest(measurements).toResponse());
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        } catch (StorageUnavailableException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        }
    }
}
