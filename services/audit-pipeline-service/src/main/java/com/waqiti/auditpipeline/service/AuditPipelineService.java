package com.waqiti.auditpipeline.service;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.dispatch.DispatchOutcome;
import com.waqiti.auditpipeline.dispatch.ViolationDispatcher;
import com.waqiti.auditpipeline.enrichment.EventEnricher;
import com.waqiti.auditpipeline.exception.AuditStorageException;
import com.waqiti.auditpipeline.exception.AuditValidationException;
import com.waqiti.auditpipeline.exception.RuleLoadException;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import com.waqiti.auditpipeline.model.AuditTrailFilter;
import com.waqiti.auditpipeline.model.ComplianceRule;
import com.waqiti.auditpipeline.model.PipelineMetricsSnapshot;
import com.waqiti.auditpipeline.model.ReportSummary;
import com.waqiti.auditpipeline.publish.AuditEventPublisher;
import com.waqiti.auditpipeline.rules.ComplianceRuleRegistry;
import com.waqiti.auditpipeline.rules.RuleEngine;
import com.waqiti.auditpipeline.store.AuditEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Entry point of the compliance audit pipeline.
 *
 * <p>{@link #logEvent(AuditEvent)} runs an event through enrichment, rule
 * evaluation, violation dispatch and secure storage, then hands the stored form
 * to subscribers. It returns once the event is durably stored, or throws
 * {@link AuditStorageException}. Alerting and auto-response failures never
 * reach the caller.
 *
 * <p>Events produced by the pipeline itself (auto-response follow-ups, logging
 * errors, lifecycle notices) go through {@link #logInternal(AuditEvent)}: they are
 * evaluated and flagged like any other event but never trigger auto-responses,
 * and their failures end in the fallback logger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditPipelineService {

    public static final String AUDIT_LOGGING_ERROR = "AUDIT_LOGGING_ERROR";
    public static final String RULES_LOAD_FAILED = "COMPLIANCE_RULES_LOAD_FAILED";

    private static final Logger FALLBACK_LOG = LoggerFactory.getLogger("AUDIT_FALLBACK");

    private final EventEnricher eventEnricher;
    private final RuleEngine ruleEngine;
    private final ComplianceRuleRegistry ruleRegistry;
    private final ViolationDispatcher violationDispatcher;
    private final SecureAuditStorage secureAuditStorage;
    private final AuditEventPublisher auditEventPublisher;
    private final ComplianceReportService reportService;
    private final AuditEventStore auditEventStore;
    private final PipelineMetrics metrics;
    private final AuditPipelineProperties properties;

    /**
     * @return the enriched event, carrying the compliance flags of every matched rule
     * @throws AuditValidationException if a required field is missing or malformed
     * @throws AuditStorageException if the event could not be persisted
     */
    public AuditEvent logEvent(AuditEvent rawEvent) {
        try {
            return process(rawEvent, true);
        } catch (AuditStorageException e) {
            metrics.error();
            log.error("Failed to persist audit event - type: {}, category: {}: {}",
                rawEvent.getEventType(), rawEvent.getEventCategory(), e.getMessage());
            if (!AUDIT_LOGGING_ERROR.equals(rawEvent.getEventType())) {
                recordLoggingError(rawEvent, e);
            }
            throw e;
        }
    }

    /**
     * Logs an event emitted by the pipeline. Never throws.
     */
    public void logInternal(AuditEvent event) {
        try {
            process(event, false);
        } catch (Exception e) {
            metrics.error();
            FALLBACK_LOG.error("Pipeline audit event lost - type: {}, description: {}: {}",
                event.getEventType(), event.getDescription(), e.getMessage());
        }
    }

    private AuditEvent process(AuditEvent rawEvent, boolean autoResponsesEnabled) {
        long started = System.nanoTime();

        AuditEvent enriched = eventEnricher.enrich(rawEvent);

        List<ComplianceRule> matched = ruleEngine.evaluate(enriched);
        if (!matched.isEmpty()) {
            Set<String> flags = new LinkedHashSet<>();
            matched.forEach(rule -> flags.add(rule.getName()));
            enriched = enriched.toBuilder().complianceFlags(List.copyOf(flags)).build();
        }

        if (!matched.isEmpty()) {
            metrics.violationsDetected(matched.size());
            // auto-response events are logged by the dispatcher as each action completes
            DispatchOutcome outcome = violationDispatcher.dispatch(enriched, matched, autoResponsesEnabled, this::logInternal);
            if (outcome.failedAlerts() > 0 || outcome.failedAutoResponses() > 0 || outcome.pendingRules() > 0) {
                log.warn("Compliance violation handled with failures - requestId: {}, failedAlerts: {}, failedAutoResponses: {}, pendingRules: {}",
                    enriched.getRequestId(), outcome.failedAlerts(), outcome.failedAutoResponses(), outcome.pendingRules());
            }
        }

        AuditEvent stored = secureAuditStorage.store(enriched);
        auditEventPublisher.publish(stored);
        metrics.eventLogged(enriched, System.nanoTime() - started);

        log.debug("Audit event logged - requestId: {}, type: {}, flags: {}",
            enriched.getRequestId(), enriched.getEventType(), enriched.getComplianceFlags());
        return enriched;
    }

    private void recordLoggingError(AuditEvent failed, AuditStorageException cause) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("originalEventType", failed.getEventType());
        if (failed.getEventCategory() != null) {
            metadata.put("originalCategory", failed.getEventCategory().getCode());
        }
        if (failed.getRequestId() != null) {
            metadata.put("originalRequestId", failed.getRequestId());
        }
        AuditEvent errorEvent = AuditEvent.builder()
            .eventType(AUDIT_LOGGING_ERROR)
            .eventCategory(AuditEventCategory.ERROR)
            .severity(AuditSeverity.HIGH)
            .description("Failed to log audit event " + failed.getEventType())
            .error(cause.getMessage())
            .errorCode(cause.getErrorCode())
            .metadata(metadata)
            .build();
        logInternal(errorEvent);
    }

    /**
     * Newest first, capped at the configured maximum.
     */
    public List<AuditEvent> queryTrail(String userId, AuditTrailFilter filter) {
        if (userId == null || userId.isBlank()) {
            throw new AuditValidationException("User id is required");
        }
        AuditTrailFilter effective = filter != null ? filter : AuditTrailFilter.none();
        if (effective.getStartDate() != null && effective.getEndDate() != null
            && effective.getStartDate().isAfter(effective.getEndDate())) {
            throw new AuditValidationException("Trail start date must not be after end date");
        }

        int max = properties.getTrail().getMaxResults();
        Integer requested = effective.getLimit();
        int limit = requested != null && requested > 0 ? Math.min(requested, max) : max;

        try {
            return new ArrayList<>(auditEventStore.findTrail(userId, effective, limit));
        } catch (AuditStorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuditStorageException("Failed to read audit trail", e);
        }
    }

    public ReportSummary report(String reportType, Instant startDate, Instant endDate) {
        return reportService.generate(reportType, startDate, endDate);
    }

    /**
     * Reloads the rule registry. A failed load keeps the cached rules and is
     * recorded as a low severity system event.
     *
     * @return the number of rules active after the call
     */
    public int reloadRules() {
        try {
            return ruleRegistry.reload().rules().size();
        } catch (RuleLoadException e) {
            logInternal(AuditEvent.builder()
                .eventType(RULES_LOAD_FAILED)
                .eventCategory(AuditEventCategory.SYSTEM_OPERATION)
                .severity(AuditSeverity.LOW)
                .description("Failed to load compliance rules, keeping cached rules")
                .error(e.getCause() != null ? e.getCause().getMessage() : e.getMessage())
                .errorCode(e.getErrorCode())
                .metadata(Map.of("cachedRules", ruleRegistry.size()))
                .build());
            return ruleRegistry.size();
        }
    }

    public PipelineMetricsSnapshot metricsSnapshot() {
        return PipelineMetricsSnapshot.builder()
            .eventsLogged(metrics.getEventsLogged())
            .complianceViolations(metrics.getComplianceViolations())
            .criticalEvents(metrics.getCriticalEvents())
            .averageLogTimeMs(metrics.getAverageLogTimeMs())
            .errors(metrics.getErrors())
            .publishDropped(metrics.getPublishDropped())
            .rulesLoaded(ruleRegistry.size())
            .serverId(properties.getServerId())
            .environment(properties.getEnvironment())
            .uptime(metrics.getUptime())
            .build();
    }
}
