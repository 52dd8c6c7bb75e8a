package com.osint.leadtrace.dto.lookup;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entity extracted by the lookup service from a source record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DiscoveredEntity {
    private String type;        // EMAIL, PHONE, USERNAME, PERSON, DOMAIN, IP, LINKEDIN_URL...
    private String value;
    private String relation;    // e.g. "registered_with", "same_breach_record"
    private String context;
}
