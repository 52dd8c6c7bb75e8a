package com.osint.leadtrace.service.investigation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outstanding work for one depth: VERIFIED leads (canonical values) and
 * UNVERIFIED leads at the start of their tag chain, both in first-seen order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriorityQueues {

    @Builder.Default
    private List<String> verifiedQueue = new ArrayList<>();

    @Builder.Default
    private List<UnverifiedLead> unverifiedQueue = new ArrayList<>();

    public static PriorityQueues empty() {
        return new PriorityQueues(new ArrayList<>(), new ArrayList<>());
    }

    public boolean isEmpty() {
        return verifiedQueue.isEmpty() && unverifiedQueue.isEmpty();
    }
}
