package com.id.swl.client.modules.api.service;

import com.id.swl.client.config.ClientConfig;
import com.id.swl.model.SwlIngestRes;
import com.id.swl.model.SwlMeasurement;
import com.id.swl.model.SwlQueryReq;
import com.id.swl.model.enums.SwlSeries;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.client.RestClientTest;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@RestClientTest({SwlApiClient.class, ClientConfig.class})
class SwlApiClientTest {

    private static final Instant T0 = Instant.parse("2004-11-07T00:00:00Z");

    @Autowired
    private SwlApiClient apiClient;

    @Autowired
    private MockRestServiceServer server;

    @Test
    void healthReturnsStatus() {
        server.expect(requestTo("/v1/health"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"status\":\"ok\"}", MediaType.APPLICATION_JSON));

        assertEquals("ok", apiClient.health().get("status"));
        server.verify();
    }

    @Test
    void ingestPostsBatchAndReadsCounts() {
        server.expect(requestTo("/v1/ingest"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$[0].time").value("2004-11-07T00:00:00Z"))
                .andExpect(jsonPath("$[0].source").value("ACE"))
                .andExpect(jsonPath("$[0].value").value(5.0))
                .andRespond(withSuccess("{\"stored_raw\":1,\"stored_min1\":1}", MediaType.APPLICATION_JSON));

        SwlIngestRes res = apiClient.ingest(List.of(SwlMeasurement.builder()
                .time(T0).source("ACE").parameter("IMF_Bz").value(5.0).build()));

        assertEquals(1, res.getStoredRaw());
        assertEquals(1, res.getStoredMin1());
        server.verify();
    }

    @Test
    void querySendsSeriesCodeAndReadsRows() {
        server.expect(requestTo("/v1/query"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.series").value("min1"))
                .andExpect(jsonPath("$.start").value("2004-11-07T00:00:00Z"))
                .andRespond(withSuccess("""
                        [{"time":"2004-11-07T00:00:00Z","source":"ACE","parameter":"IMF_Bz","value":5.0,"quality":null},
                         {"time":"2004-11-07T00:01:00Z","source":"ACE","parameter":"IMF_Bz","value":6.0,"quality":null}]
                        """, MediaType.APPLICATION_JSON));

        List<SwlMeasurement> rows = apiClient.query(SwlQueryReq.builder()
                .source("ACE")
                .parameter("IMF_Bz")
                .start(T0)
                .end(T0.plusSeconds(7200))
                .series(SwlSeries.MIN1)
                .build());

        assertEquals(2, rows.size());
        assertEquals(T0.plusSeconds(60), rows.get(1).getTime());
        assertEquals(6.0, rows.get(1).getValue());
        server.verify();
    }

    @Test
    void serverErrorsPropagate() {
        server.expect(requestTo("/v1/ingest"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThrows(HttpServerErrorException.class, () -> apiClient.ingest(List.of(SwlMeasurement.builder()
                .time(T0).source("ACE").parameter("IMF_Bz").value(5.0).build())));
    }
}
