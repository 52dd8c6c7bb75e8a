package com.osint.leadtrace.service.investigation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromotionResult {
    private boolean success;
    private int edgesUpdated;
    private int nodesUpdated;
    private int exactIdMatches;
    private int tagSubstringMatches;

    public static PromotionResult failed() {
        return new PromotionResult(false, 0, 0, 0, 0);
    }
}
