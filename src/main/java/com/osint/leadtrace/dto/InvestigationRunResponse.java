package com.osint.leadtrace.dto;

import com.osint.leadtrace.service.investigation.InvestigationSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvestigationRunResponse {

    private String id;
    private String projectId;
    private String seedQuery;
    private String seedValue;
    private String seedType;
    private int maxDepth;
    private String status;
    private String errorMessage;
    private InvestigationSummary summary;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime expiresAt;
}
