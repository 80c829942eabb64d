package com.waqiti.auditpipeline.dispatch;

import com.waqiti.auditpipeline.client.AccountServiceClient;
import com.waqiti.auditpipeline.client.AccountStatusRequest;
import com.waqiti.auditpipeline.client.ComplianceCaseClient;
import com.waqiti.auditpipeline.client.ComplianceCaseRequest;
import com.waqiti.auditpipeline.client.RiskScoreRequest;
import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import com.waqiti.auditpipeline.model.AutoResponse;
import com.waqiti.auditpipeline.model.ComplianceRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Executes a rule's automated response. Account actions return the follow-up
 * audit event describing what was done; the caller logs it.
 * Exceptions from collaborators propagate to the dispatcher.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AutoResponseExecutor {

    public static final String USER_BLOCKED_EVENT = "USER_BLOCKED_AUTOMATICALLY";
    public static final String ACCOUNT_FLAGGED_EVENT = "ACCOUNT_FLAGGED_AUTOMATICALLY";

    private final AccountServiceClient accountServiceClient;
    private final ComplianceCaseClient complianceCaseClient;
    private final AuditPipelineProperties properties;

    public Optional<AuditEvent> execute(AuditEvent event, ComplianceRule rule) {
        AutoResponse autoResponse = rule.getAutoResponse();
        if (autoResponse == null || autoResponse.getAction() == null) {
            return Optional.empty();
        }
        if (autoResponse.getAction().isUserScoped() && event.getUserId() == null) {
            log.warn("Skipping auto-response without user id - action: {}, rule: {}, requestId: {}",
                autoResponse.getAction().getCode(), rule.getName(), event.getRequestId());
            return Optional.empty();
        }

        return switch (autoResponse.getAction()) {
            case BLOCK_USER -> Optional.of(blockUser(event, rule));
            case FLAG_ACCOUNT -> Optional.of(flagAccount(event, rule));
            case NOTIFY_COMPLIANCE -> {
                complianceCaseClient.notifyCompliance(caseRequest(event, rule));
                log.info("Compliance team notified - rule: {}, requestId: {}", rule.getName(), event.getRequestId());
                yield Optional.empty();
            }
            case CREATE_TICKET -> {
                complianceCaseClient.createTicket(caseRequest(event, rule));
                log.info("Compliance ticket created - rule: {}, requestId: {}", rule.getName(), event.getRequestId());
                yield Optional.empty();
            }
        };
    }

    private AuditEvent blockUser(AuditEvent event, ComplianceRule rule) {
        accountServiceClient.setAccountStatus(event.getUserId(), idempotencyKey(event, rule),
            AccountStatusRequest.builder()
                .status(AccountStatusRequest.BLOCKED)
                .reason("Compliance rule violation: " + rule.getName())
                .ruleId(rule.getId())
                .sourceRequestId(event.getRequestId())
                .build());
        log.warn("User blocked automatically - userId: {}, rule: {}", event.getUserId(), rule.getName());

        return followUp(event, rule, USER_BLOCKED_EVENT, AuditEventCategory.SECURITY, AuditSeverity.HIGH,
            "User blocked due to compliance violation");
    }

    private AuditEvent flagAccount(AuditEvent event, ComplianceRule rule) {
        int floor = properties.getAutoResponse().getFlagRiskScore();
        accountServiceClient.raiseRiskScore(event.getUserId(), idempotencyKey(event, rule),
            RiskScoreRequest.builder()
                .minimumScore(floor)
                .reason("Compliance rule violation: " + rule.getName())
                .ruleId(rule.getId())
                .sourceRequestId(event.getRequestId())
                .build());
        log.info("Account flagged for review - userId: {}, minimumRiskScore: {}", event.getUserId(), floor);

        return followUp(event, rule, ACCOUNT_FLAGGED_EVENT, AuditEventCategory.COMPLIANCE, AuditSeverity.MEDIUM,
            "Account flagged for compliance review");
    }

    private AuditEvent followUp(AuditEvent source, ComplianceRule rule, String eventType,
                                AuditEventCategory category, AuditSeverity severity, String description) {
        Map<String, Object> metadata = new LinkedHashMap<>(rule.getAutoResponse().getParameters());
        metadata.put("ruleId", rule.getId());
        metadata.put("ruleName", rule.getName());
        metadata.put("sourceRequestId", source.getRequestId());

        return AuditEvent.builder()
            .eventType(eventType)
            .eventCategory(category)
            .userId(source.getUserId())
            .description(description)
            .severity(severity)
            .metadata(metadata)
            .build();
    }

    private ComplianceCaseRequest caseRequest(AuditEvent event, ComplianceRule rule) {
        return ComplianceCaseRequest.builder()
            .ruleId(rule.getId())
            .ruleName(rule.getName())
            .severity(rule.getSeverity().name())
            .eventRequestId(event.getRequestId())
            .eventType(event.getEventType())
            .eventCategory(event.getEventCategory().getCode())
            .userId(event.getUserId())
            .description(event.getDescription())
            .eventTimestamp(event.getTimestamp())
            .parameters(rule.getAutoResponse().getParameters())
            .build();
    }

    static String idempotencyKey(AuditEvent event, ComplianceRule rule) {
        return event.getRequestId() + ":" + rule.getId();
    }
}
