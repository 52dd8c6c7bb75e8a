package com.osint.leadtrace.service.graph;

import com.osint.leadtrace.model.graph.VerificationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {
    private String searchedNodeId;
    private String evidenceNodeId;
    private VerificationStatus verificationStatus;
    private int entitiesLinked;
    private int entitiesCreated;
    private int entitiesSkipped;
}
