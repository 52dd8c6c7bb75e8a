package com.osint.leadtrace.service.search;

import com.osint.leadtrace.dto.lookup.LookupResponse;
import com.osint.leadtrace.exception.LookupClientException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * REST client for the OSINT lookup service, which fronts the breach databases and
 * enrichment sources and returns already-extracted entities.
 *
 * POST {base-url}/api/lookup/{type}  {"value": "..."}
 */
@Service
@Slf4j
public class LookupClient {

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String apiKey;

    public LookupClient(RestTemplate lookupRestTemplate,
                        @Value("${leadtrace.lookup.base-url}") String baseUrl,
                        @Value("${leadtrace.lookup.api-key:}") String apiKey) {
        this.restTemplate = lookupRestTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
    }

    public LookupResponse lookup(QueryType type, String value) {
        String url = String.format("%s/api/lookup/%s", baseUrl, type.getLookupPath());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set("X-API-Key", apiKey);
        }
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(Map.of("value", value), headers);

        try {
            ResponseEntity<LookupResponse> response = restTemplate.exchange(url, HttpMethod.POST, entity, LookupResponse.class);
            LookupResponse body = response.getBody();
            if (body == null) {
                throw new LookupClientException("Empty lookup response for " + type + " " + value,
                        response.getStatusCode().value());
            }
            log.debug("[Lookup] {} {} -> {} entities from {}", type, value,
                    body.getEntities() != null ? body.getEntities().size() : 0, body.getSource());
            return body;
        } catch (HttpStatusCodeException e) {
            log.error("[Lookup] {} {} failed with status {}", type, value, e.getStatusCode().value());
            throw new LookupClientException("Lookup " + type + " returned " + e.getStatusCode().value(),
                    e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            log.error("[Lookup] {} {} failed: {}", type, value, e.getMessage());
            throw new LookupClientException("Lookup " + type + " failed: " + e.getMessage(), e);
        }
    }
}
