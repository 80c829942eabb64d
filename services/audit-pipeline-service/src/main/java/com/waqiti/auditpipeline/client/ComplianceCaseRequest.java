package com.waqiti.auditpipeline.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceCaseRequest {
    private String ruleId;
    private String ruleName;
    private String severity;
    private String eventRequestId;
    private String eventType;
    private String eventCategory;
    private String userId;
    private String description;
    private Instant eventTimestamp;
    private Map<String, Object> parameters;
}
