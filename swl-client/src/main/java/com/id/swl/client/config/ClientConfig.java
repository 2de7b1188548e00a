package com.id.swl.client.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class ClientConfig {

    @Value("${swl.client.api-base-url:http://localhost:8080}")
    private String apiBaseUrl;

    @Value("${swl.client.connect-timeout-ms:10000}")
    private long connectTimeoutMs;

    @Value("${swl.client.read-timeout-ms:60000}")
    private long readTimeoutMs;

}
