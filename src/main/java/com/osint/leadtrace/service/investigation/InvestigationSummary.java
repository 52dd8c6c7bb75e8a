package com.osint.leadtrace.service.investigation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Counters and diagnostics of one scheduler run. The seed search counts towards
 * {@code totalSearches} only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvestigationSummary {

    private int totalSearches;
    private int verifiedSearches;
    private int unverifiedSearches;
    private int upgradedCount;
    private int finalDepth;

    @Builder.Default
    private List<Promotion> promotions = new ArrayList<>();

    // "<entity>: <reason>" for leads that stayed UNVERIFIED or failed
    @Builder.Default
    private List<String> diagnostics = new ArrayList<>();

    private String error;

    public boolean isFailed() {
        return error != null;
    }
}
