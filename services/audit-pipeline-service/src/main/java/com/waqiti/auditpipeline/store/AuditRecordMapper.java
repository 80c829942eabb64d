package com.waqiti.auditpipeline.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waqiti.auditpipeline.domain.AuditLogRecord;
import com.waqiti.auditpipeline.domain.ViolationRecord;
import com.waqiti.auditpipeline.exception.AuditStorageException;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.Violation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Maps between pipeline events and persisted records.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AuditRecordMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<String>> LIST_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public AuditLogRecord toRecord(AuditEvent event, Instant recordedAt) {
        int retentionYears = event.getRetentionYears() != null
            ? event.getRetentionYears()
            : event.getEventCategory().getDefaultRetentionYears();

        return AuditLogRecord.builder()
            .requestId(event.getRequestId())
            .eventType(event.getEventType())
            .eventCategory(event.getEventCategory())
            .description(event.getDescription())
            .userId(event.getUserId())
            .userEmail(event.getUserEmail())
            .sessionId(event.getSessionId())
            .ipAddressHash(event.getIpAddress())
            .userAgent(event.getUserAgent())
            .endpoint(event.getEndpoint())
            .httpMethod(event.getHttpMethod())
            .resourceType(event.getResourceType())
            .resourceId(event.getResourceId())
            .amount(event.getAmount())
            .currency(event.getCurrency())
            .productId(event.getProductId())
            .institutionId(event.getInstitutionId())
            .requestData(writeJson(event.getRequestData()))
            .responseData(writeJson(event.getResponseData()))
            .responseStatus(event.getResponseStatus())
            .severity(event.getSeverity())
            .riskScore(event.getRiskScore())
            .complianceFlags(event.hasComplianceFlags() ? writeJson(event.getComplianceFlags()) : null)
            .error(event.getError())
            .errorCode(event.getErrorCode())
            .stackTrace(event.getStackTrace())
            .metadata(writeJson(event.getMetadata()))
            .eventTimestamp(event.getTimestamp())
            .serverId(event.getServerId())
            .environment(event.getEnvironment())
            .requiresRetention(!Boolean.FALSE.equals(event.getRequiresRetention()))
            .retentionYears(retentionYears)
            .personalDataIncluded(event.isPersonalDataIncluded())
            .sensitiveDataIncluded(event.isSensitiveDataIncluded())
            .recordedAt(recordedAt)
            .expiresAt(expiresAt(recordedAt, retentionYears))
            .build();
    }

    public AuditEvent toEvent(AuditLogRecord record) {
        return AuditEvent.builder()
            .requestId(record.getRequestId())
            .timestamp(record.getEventTimestamp())
            .eventType(record.getEventType())
            .eventCategory(record.getEventCategory())
            .description(record.getDescription())
            .userId(record.getUserId())
            .userEmail(record.getUserEmail())
            .sessionId(record.getSessionId())
            .ipAddress(record.getIpAddressHash())
            .userAgent(record.getUserAgent())
            .endpoint(record.getEndpoint())
            .httpMethod(record.getHttpMethod())
            .resourceType(record.getResourceType())
            .resourceId(record.getResourceId())
            .amount(record.getAmount())
            .currency(record.getCurrency())
            .productId(record.getProductId())
            .institutionId(record.getInstitutionId())
            .requestData(readMap(record.getRequestData()))
            .responseData(readMap(record.getResponseData()))
            .responseStatus(record.getResponseStatus())
            .severity(record.getSeverity())
            .riskScore(record.getRiskScore())
            .complianceFlags(readList(record.getComplianceFlags()))
            .error(record.getError())
            .errorCode(record.getErrorCode())
            .stackTrace(record.getStackTrace())
            .metadata(readMap(record.getMetadata()))
            .serverId(record.getServerId())
            .environment(record.getEnvironment())
            .requiresRetention(record.isRequiresRetention())
            .retentionYears(record.getRetentionYears())
            .personalDataIncluded(record.isPersonalDataIncluded())
            .sensitiveDataIncluded(record.isSensitiveDataIncluded())
            .build();
    }

    public ViolationRecord toRecord(Violation violation, String protectedSnapshot, boolean encrypted) {
        return ViolationRecord.builder()
            .eventRequestId(violation.getEventRequestId())
            .ruleId(violation.getRuleId())
            .ruleName(violation.getRuleName())
            .severity(violation.getSeverity())
            .detectedAt(violation.getDetectedAt())
            .eventSnapshot(protectedSnapshot)
            .snapshotEncrypted(encrypted)
            .build();
    }

    public String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AuditStorageException("Audit payload is not serializable", e);
        }
    }

    static Instant expiresAt(Instant recordedAt, int retentionYears) {
        return recordedAt.atOffset(ZoneOffset.UTC).plusYears(retentionYears).toInstant();
    }

    private Map<String, Object> readMap(String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable payload column in audit record: {}", e.getOriginalMessage());
            return null;
        }
    }

    private List<String> readList(String json) {
        if (json == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, LIST_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable compliance flags in audit record: {}", e.getOriginalMessage());
            return List.of();
        }
    }
}
