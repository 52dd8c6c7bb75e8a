package com.osint.leadtrace.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartInvestigationRequest {

    @NotBlank(message = "Seed query is required")
    private String seedQuery;

    // Optional; the configured default applies when absent
    private Integer maxDepth;
}
