package com.waqiti.auditpipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class ReportSummary {
    String reportType;
    Instant periodStart;
    Instant periodEnd;
    Instant generatedAt;
    long totalEvents;
    long criticalEvents;
    long highEvents;
    long violations;

    @Singular
    List<ReportLine> details;
}
