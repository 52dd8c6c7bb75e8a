package com.osint.leadtrace.service.investigation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnverifiedLead {
    private String entityValue;
    private String tag;
}
