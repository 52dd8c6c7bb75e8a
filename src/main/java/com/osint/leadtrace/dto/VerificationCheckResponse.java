package com.osint.leadtrace.dto;

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
public class VerificationCheckResponse {

    private String projectId;
    private String entityValue;
    private boolean shouldUpgrade;
    private String reason;

    @Builder.Default
    private List<String> evidence = new ArrayList<>();
}
