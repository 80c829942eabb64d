package com.waqiti.auditpipeline.dto;

import com.waqiti.auditpipeline.model.AuditEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class LogAuditEventResponse {
    String requestId;
    Instant timestamp;
    List<String> complianceFlags;
    int retentionYears;

    public static LogAuditEventResponse from(AuditEvent event) {
        return LogAuditEventResponse.builder()
            .requestId(event.getRequestId())
            .timestamp(event.getTimestamp())
            .complianceFlags(event.getComplianceFlags())
            .retentionYears(event.getRetentionYears())
            .build();
    }
}
