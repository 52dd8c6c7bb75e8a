package com.osint.leadtrace.model;

import com.osint.leadtrace.service.investigation.InvestigationSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

/**
 * MongoDB document tracking one recursive investigation started from a seed query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "investigation_runs")
public class InvestigationRun {

    @Id
    private String id;

    @Indexed
    private String projectId;

    private String seedQuery;       // as submitted
    private String seedValue;       // markers stripped, what the scheduler searches
    private String seedType;        // detected query type
    private int maxDepth;

    private String status;          // PENDING, RUNNING, COMPLETED, FAILED
    private String errorMessage;

    private InvestigationSummary summary;

    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Indexed
    private LocalDateTime expiresAt; // For cleanup scheduler

    public static class Status {
        public static final String PENDING = "PENDING";
        public static final String RUNNING = "RUNNING";
        public static final String COMPLETED = "COMPLETED";
        public static final String FAILED = "FAILED";
    }
}
