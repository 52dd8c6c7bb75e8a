package com.osint.leadtrace.dto;

import com.osint.leadtrace.service.investigation.UnverifiedLead;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of the work the next depth of an investigation would pick up.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueSnapshotResponse {

    private String projectId;

    @Builder.Default
    private List<String> verifiedQueue = new ArrayList<>();

    @Builder.Default
    private List<UnverifiedLead> unverifiedQueue = new ArrayList<>();

    private int verifiedCount;
    private int unverifiedCount;
}
