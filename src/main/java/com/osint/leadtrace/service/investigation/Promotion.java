package com.osint.leadtrace.service.investigation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Promotion {
    private String entityValue;
    private String reason;
    private int depth;
    private int edgesUpdated;
}
