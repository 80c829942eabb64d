package com.waqiti.auditpipeline.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReportLine {
    AuditEventCategory eventCategory;
    String eventType;
    long eventCount;
    long criticalCount;
    long highCount;
    long violationCount;
}
