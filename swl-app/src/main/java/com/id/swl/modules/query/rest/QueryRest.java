package com.id.swl.modules.query.rest;

import com.id.swl.exceptions.StorageUnavailableException;
import com.id.swl.model.SwlMeasurement;
import com.id.swl.model.SwlQueryReq;
import com.id.swl.modules.query.service.SeriesQueryService;
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
public class QueryRest {

    private final SeriesQueryService seriesQueryService;

    public QueryRest(SeriesQueryService seriesQueryService) {
        this.seriesQueryService = seriesQueryService;
    }

    @PostMapping("query")
    public ResponseEntity<List<SwlMeasurement>> query(@RequestBody SwlQueryReq req) {
        checkRequest(req);
        try {
            return ResponseEntity.ok(seriesQueryService.find(req));
        } catch (StorageUnavailableException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
        }
    }

    private static void checkRequest(SwlQueryReq req) {
        if (req.getSource() == null || req.getSource().isBlank()
                || req.getParameter() == null || req.getParameter().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Source and parameter cannot be null or blank");
        }
        if (req.getStart() == null || req.getEnd() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Start and/or End params cannot be null");
        }
        if (!req.getEnd().isAfter(req.getStart())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "End must be after Start");
        }
    }
}
