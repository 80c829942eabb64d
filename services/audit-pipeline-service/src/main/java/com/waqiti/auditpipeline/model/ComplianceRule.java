package com.waqiti.auditpipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Set;

/**
 * Named predicate over audit event fields. A rule matches an event when the
 * event type is one of {@link #eventTypes} and every condition holds.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ComplianceRule {
    String id;
    String name;
    String description;

    @Singular
    Set<String> eventTypes;

    @Singular
    List<RuleCondition> conditions;

    @Builder.Default
    AuditSeverity severity = AuditSeverity.MEDIUM;

    @Singular
    List<AlertChannel> alertChannels;

    AutoResponse autoResponse;

    @Builder.Default
    boolean active = true;

    public boolean appliesTo(String eventType) {
        return active && eventType != null && eventTypes.contains(eventType);
    }
}
