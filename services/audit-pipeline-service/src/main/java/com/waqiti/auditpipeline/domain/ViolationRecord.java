package com.waqiti.auditpipeline.domain;

import com.waqiti.auditpipeline.model.AuditSeverity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "compliance_violations", indexes = {
    @Index(name = "idx_violation_event", columnList = "event_request_id"),
    @Index(name = "idx_violation_rule", columnList = "rule_id"),
    @Index(name = "idx_violation_detected", columnList = "detected_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ViolationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false)
    private UUID id;

    @Column(name = "event_request_id", nullable = false, updatable = false, length = 64)
    private String eventRequestId;

    @Column(name = "rule_id", updatable = false)
    private String ruleId;

    @Column(name = "rule_name", nullable = false, updatable = false)
    private String ruleName;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, updatable = false, length = 10)
    private AuditSeverity severity;

    @Column(name = "detected_at", nullable = false, updatable = false)
    private Instant detectedAt;

    /**
     * Redacted event snapshot, AES-GCM encrypted when a snapshot key is configured.
     */
    @Column(name = "event_snapshot", nullable = false, updatable = false, columnDefinition = "TEXT")
    private String eventSnapshot;

    @Column(name = "snapshot_encrypted", nullable = false, updatable = false)
    private boolean snapshotEncrypted;
}
