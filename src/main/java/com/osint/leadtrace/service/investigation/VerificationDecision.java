package com.osint.leadtrace.service.investigation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationDecision {

    public static final String ENTITY_NOT_FOUND = "entity_not_found";
    public static final String NO_VERIFIED_CONNECTIONS = "no_verified_connections";

    private boolean shouldUpgrade;

    private String reason;

    // same_breach_record:<id> / cooccurs_with_verified:<targetId>, one per corroborating evidence node
    @Builder.Default
    private List<String> evidence = new ArrayList<>();

    public static VerificationDecision rejected(String reason) {
        return new VerificationDecision(false, reason, new ArrayList<>());
    }
}
