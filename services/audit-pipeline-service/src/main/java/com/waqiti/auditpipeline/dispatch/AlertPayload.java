package com.waqiti.auditpipeline.dispatch;

import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditSeverity;
import com.waqiti.auditpipeline.model.ComplianceRule;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Channel independent alert content. Carries an event summary, never its payloads.
 */
@Value
@Builder
public class AlertPayload {
    String ruleId;
    String ruleName;
    AuditSeverity severity;
    String eventRequestId;
    String eventType;
    String eventCategory;
    String description;
    String userId;
    Instant eventTimestamp;
    Map<String, Object> metadata;

    public static AlertPayload of(AuditEvent event, ComplianceRule rule) {
        return AlertPayload.builder()
            .ruleId(rule.getId())
            .ruleName(rule.getName())
            .severity(rule.getSeverity())
            .eventRequestId(event.getRequestId())
            .eventType(event.getEventType())
            .eventCategory(event.getEventCategory().getCode())
            .description(event.getDescription())
            .userId(event.getUserId())
            .eventTimestamp(event.getTimestamp())
            .metadata(event.getMetadata())
            .build();
    }

    public String subject() {
        return String.format("[%s] Compliance rule '%s' triggered by %s", severity, ruleName, eventType);
    }

    public String summary() {
        return String.format("%s%nEvent: %s (%s)%nUser: %s%nRequest: %s%nAt: %s",
            subject(), description, eventCategory,
            userId != null ? userId : "n/a", eventRequestId, eventTimestamp);
    }
}
