package com.osint.leadtrace.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Value("${leadtrace.lookup.connect-timeout:10}")
    private int connectTimeoutSeconds;

    @Value("${leadtrace.lookup.read-timeout:60}")
    private int readTimeoutSeconds;

    /**
     * RestTemplate for the OSINT lookup service. A lookup may fan out to many
     * sources behind the service, hence the long read timeout.
     */
    @Bean
    public RestTemplate lookupRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds))
                .setReadTimeout(Duration.ofSeconds(readTimeoutSeconds))
                .build();
    }
}
