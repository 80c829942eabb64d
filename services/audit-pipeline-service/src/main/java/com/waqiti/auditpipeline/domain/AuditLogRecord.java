package com.waqiti.auditpipeline.domain;

import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted, immutable audit trail entry. Every column is insert-only;
 * payload and flag columns hold JSON written by {@code AuditRecordMapper}.
 */
@Entity
@Table(name = "compliance_audit_log", indexes = {
    @Index(name = "idx_audit_log_user", columnList = "user_id"),
    @Index(name = "idx_audit_log_event_type", columnList = "event_type"),
    @Index(name = "idx_audit_log_recorded", columnList = "recorded_at"),
    @Index(name = "idx_audit_log_expiry", columnList = "requires_retention,expires_at"),
    @Index(name = "idx_audit_log_request", columnList = "request_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuditLogRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false)
    private UUID id;

    @Column(name = "request_id", nullable = false, updatable = false, length = 64)
    private String requestId;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Convert(converter = AuditEventCategoryConverter.class)
    @Column(name = "event_category", nullable = false, updatable = false, length = 50)
    private AuditEventCategory eventCategory;

    @Column(name = "description", updatable = false, columnDefinition = "TEXT")
    private String description;

    @Column(name = "user_id", updatable = false)
    private String userId;

    @Column(name = "user_email", updatable = false)
    private String userEmail;

    @Column(name = "session_id", updatable = false)
    private String sessionId;

    @Column(name = "ip_address_hash", updatable = false, length = 16)
    private String ipAddressHash;

    @Column(name = "user_agent", updatable = false, columnDefinition = "TEXT")
    private String userAgent;

    @Column(name = "endpoint", updatable = false)
    private String endpoint;

    @Column(name = "http_method", updatable = false, length = 10)
    private String httpMethod;

    @Column(name = "resource_type", updatable = false, length = 50)
    private String resourceType;

    @Column(name = "resource_id", updatable = false)
    private String resourceId;

    @Column(name = "amount", updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "currency", updatable = false, length = 3)
    private String currency;

    @Column(name = "product_id", updatable = false)
    private String productId;

    @Column(name = "institution_id", updatable = false)
    private String institutionId;

    @Column(name = "request_data", updatable = false, columnDefinition = "TEXT")
    private String requestData;

    @Column(name = "response_data", updatable = false, columnDefinition = "TEXT")
    private String responseData;

    @Column(name = "response_status", updatable = false)
    private Integer responseStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, updatable = false, length = 10)
    private AuditSeverity severity;

    @Column(name = "risk_score", updatable = false)
    private Integer riskScore;

    /**
     * JSON array of violated rule names, {@code null} when no rule matched.
     */
    @Column(name = "compliance_flags", updatable = false, columnDefinition = "TEXT")
    private String complianceFlags;

    @Column(name = "error", updatable = false, columnDefinition = "TEXT")
    private String error;

    @Column(name = "error_code", updatable = false)
    private String errorCode;

    @Column(name = "stack_trace", updatable = false, columnDefinition = "TEXT")
    private String stackTrace;

    @Column(name = "metadata", updatable = false, columnDefinition = "TEXT")
    private String metadata;

    @Column(name = "event_timestamp", nullable = false, updatable = false)
    private Instant eventTimestamp;

    @Column(name = "server_id", updatable = false, length = 50)
    private String serverId;

    @Column(name = "environment", updatable = false, length = 30)
    private String environment;

    @Column(name = "requires_retention", nullable = false, updatable = false)
    private boolean requiresRetention;

    @Column(name = "retention_years", nullable = false, updatable = false)
    private int retentionYears;

    @Column(name = "personal_data_included", nullable = false, updatable = false)
    private boolean personalDataIncluded;

    @Column(name = "sensitive_data_included", nullable = false, updatable = false)
    private boolean sensitiveDataIncluded;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;
}
