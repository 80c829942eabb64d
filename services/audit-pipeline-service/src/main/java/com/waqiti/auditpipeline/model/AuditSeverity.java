package com.waqiti.auditpipeline.model;

public enum AuditSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
