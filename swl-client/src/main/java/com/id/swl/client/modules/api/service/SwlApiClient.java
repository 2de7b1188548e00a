package com.id.swl.client.modules.api.service;

import com.id.swl.client.config.ClientConfig;
import com.id.swl.model.SwlIngestRes;
import com.id.swl.model.SwlMeasurement;
import com.id.swl.model.SwlQueryReq;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper over the /v1 endpoints of the measurement service.
 */
@Service
@Slf4j
public class SwlApiClient {

    private static final ParameterizedTypeReference<Map<String, Object>> HEALTH_TYPE = new ParameterizedTypeReference<>() {
    };
    private static final ParameterizedTypeReference<List<SwlMeasurement>> ROWS_TYPE = new ParameterizedTypeReference<>() {
    };

    private final RestTemplate restTemplate;

    public SwlApiClient(RestTemplateBuilder restTemplateBuilder, ClientConfig clientConfig) {
        this.restTemplate = restTemplateBuilder
                .rootUri(stripTrailingSlash(clientConfig.getApiBaseUrl()))
                .connectTimeout(Duration.ofMillis(clientConfig.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(clientConfig.getReadTimeoutMs()))
                .build();
        log.debug("API client bound to %s".formatted(clientConfig.getApiBaseUrl()));
    }

    public Map<String, Object> health() {
        return restTemplate.exchange("/v1/health", HttpMethod.GET, null, HEALTH_TYPE).getBody();
    }

    public SwlIngestRes ingest(List<SwlMeasurement> batch) {
        SwlIngestRes res = restTemplate.postForObject("/v1/ingest", jsonEntity(batch), SwlIngestRes.class);
        return res != null ? res : new SwlIngestRes(0, 0);
    }

    public List<SwlMeasurement> query(SwlQueryReq req) {
        List<SwlMeasurement> rows = restTemplate.exchange("/v1/query", HttpMethod.POST, jsonEntity(req), ROWS_TYPE).getBody();
        return rows != null ? rows : List.of();
    }

    private static <T> HttpEntity<T> jsonEntity(T body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
