package com.waqiti.auditpipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One rule matching one event. Never mutated after creation.
 */
@Value
@Builder
public class Violation {
    String eventRequestId;
    String ruleId;
    String ruleName;
    AuditSeverity severity;
    Instant detectedAt;
    AuditEvent eventSnapshot;

    public static Violation of(AuditEvent event, ComplianceRule rule, Instant detectedAt) {
        return Violation.builder()
            .eventRequestId(event.getRequestId())
            .ruleId(rule.getId())
            .ruleName(rule.getName())
            .severity(rule.getSeverity())
            .detectedAt(detectedAt)
            .eventSnapshot(event)
            .build();
    }
}
