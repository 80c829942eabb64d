package com.waqiti.auditpipeline.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The unit of record of the compliance audit trail.
 *
 * <p>Instances are immutable. Enrichment, rule flagging and secure storage each
 * produce a new copy through {@link #toBuilder()}; a persisted event is never
 * changed, corrections are logged as new events.
 *
 * <p>{@code complianceFlags}, {@code personalDataIncluded},
 * {@code sensitiveDataIncluded} and {@code retentionYears} are owned by the
 * pipeline and overwritten during enrichment whatever the caller supplied.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AuditEvent {

    // Identity
    String requestId;
    Instant timestamp;

    // Classification
    String eventType;
    AuditEventCategory eventCategory;
    String description;

    // Actor and request context
    String userId;
    String userEmail;
    String sessionId;
    String ipAddress;
    String userAgent;
    String endpoint;
    String httpMethod;

    // Resource and business context
    String resourceType;
    String resourceId;
    BigDecimal amount;
    String currency;
    String productId;
    String institutionId;

    // Payloads
    Map<String, Object> requestData;
    Map<String, Object> responseData;
    Integer responseStatus;

    // Risk and compliance
    AuditSeverity severity;
    Integer riskScore;

    @Builder.Default
    List<String> complianceFlags = List.of();

    // Error context
    String error;
    String errorCode;
    String stackTrace;

    Map<String, Object> metadata;
    String serverId;
    String environment;

    // Retention
    Boolean requiresRetention;
    Integer retentionYears;
    boolean personalDataIncluded;
    boolean sensitiveDataIncluded;

    public boolean hasComplianceFlags() {
        return complianceFlags != null && !complianceFlags.isEmpty();
    }
}
