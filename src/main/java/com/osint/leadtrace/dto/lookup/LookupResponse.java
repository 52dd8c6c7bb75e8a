package com.osint.leadtrace.dto.lookup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one lookup against the OSINT lookup service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LookupResponse {

    private String source;      // aggregator / breach database that answered

    @Builder.Default
    private List<DiscoveredEntity> entities = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> raw = new HashMap<>();
}
