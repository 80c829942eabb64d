package com.waqiti.auditpipeline.domain;

import com.waqiti.auditpipeline.model.AuditSeverity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stored compliance rule. List and object columns hold JSON.
 */
@Entity
@Table(name = "compliance_rules")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceRuleRecord {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "event_types", nullable = false, columnDefinition = "TEXT")
    private String eventTypes;

    @Column(name = "conditions", columnDefinition = "TEXT")
    private String conditions;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, length = 10)
    private AuditSeverity severity;

    @Column(name = "alert_channels", columnDefinition = "TEXT")
    private String alertChannels;

    @Column(name = "auto_response", columnDefinition = "TEXT")
    private String autoResponse;

    @Column(name = "is_active", nullable = false)
    private boolean active;
}
