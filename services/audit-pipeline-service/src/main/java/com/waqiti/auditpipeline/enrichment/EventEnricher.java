package com.waqiti.auditpipeline.enrichment;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.exception.AuditValidationException;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Stamps a raw caller event with identity, time, retention class and
 * data-sensitivity flags. Reads the clock; performs no other I/O.
 */
@Component
@Slf4j
public class EventEnricher {

    private final DataSensitivityClassifier classifier;
    private final Clock clock;
    private final String serverId;
    private final String environment;

    @Autowired
    public EventEnricher(DataSensitivityClassifier classifier, Clock clock, AuditPipelineProperties properties) {
        this(classifier, clock, properties.getServerId(), properties.getEnvironment());
    }

    EventEnricher(DataSensitivityClassifier classifier, Clock clock, String serverId, String environment) {
        this.classifier = classifier;
        this.clock = clock;
        this.serverId = serverId;
        this.environment = environment;
    }

    public AuditEvent enrich(AuditEvent raw) {
        validate(raw);

        AuditEventCategory category = raw.getEventCategory();
        AuditEvent enriched = raw.toBuilder()
            .timestamp(raw.getTimestamp() != null ? raw.getTimestamp() : clock.instant())
            .requestId(isBlank(raw.getRequestId()) ? UUID.randomUUID().toString() : raw.getRequestId())
            .severity(raw.getSeverity() != null ? raw.getSeverity() : AuditSeverity.LOW)
            .requiresRetention(!Boolean.FALSE.equals(raw.getRequiresRetention()))
            .retentionYears(resolveRetentionYears(raw.getRetentionYears(), category))
            .personalDataIncluded(classifier.containsPersonalData(raw))
            .sensitiveDataIncluded(classifier.containsSensitiveData(raw))
            .complianceFlags(List.of())
            .serverId(serverId)
            .environment(environment)
            .build();

        warnOnIncompleteContext(enriched);
        return enriched;
    }

    static int resolveRetentionYears(Integer requested, AuditEventCategory category) {
        if (requested != null && requested > 0) {
            return requested;
        }
        return category.getDefaultRetentionYears();
    }

    private void validate(AuditEvent raw) {
        if (raw == null) {
            throw new AuditValidationException("Audit event is required");
        }
        if (isBlank(raw.getEventType())) {
            throw new AuditValidationException("Event type is required");
        }
        if (raw.getEventCategory() == null) {
            throw new AuditValidationException("Event category is required");
        }
        if (isBlank(raw.getDescription())) {
            throw new AuditValidationException("Event description is required");
        }
        if (raw.getRiskScore() != null && (raw.getRiskScore() < 0 || raw.getRiskScore() > 100)) {
            throw new AuditValidationException("Risk score must be between 0 and 100");
        }
    }

    private void warnOnIncompleteContext(AuditEvent event) {
        if (event.isPersonalDataIncluded() && event.getUserId() == null) {
            log.warn("Personal data included but no user id provided - eventType: {}", event.getEventType());
        }
        if (event.getEventCategory() == AuditEventCategory.FINANCIAL_TRANSACTION && event.getAmount() == null) {
            log.warn("Financial transaction event without amount - eventType: {}", event.getEventType());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
