package com.waqiti.auditpipeline.service;

import com.waqiti.auditpipeline.exception.AuditStorageException;
import com.waqiti.auditpipeline.exception.AuditValidationException;
import com.waqiti.auditpipeline.model.ReportLine;
import com.waqiti.auditpipeline.model.ReportSummary;
import com.waqiti.auditpipeline.store.AuditEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Read-only time-window summaries over the persisted trail.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ComplianceReportService {

    private final AuditEventStore auditEventStore;
    private final Clock clock;

    public ReportSummary generate(String reportType, Instant startDate, Instant endDate) {
        if (reportType == null || reportType.isBlank()) {
            throw new AuditValidationException("Report type is required");
        }
        if (startDate == null || endDate == null) {
            throw new AuditValidationException("Report window requires both start and end date");
        }
        if (startDate.isAfter(endDate)) {
            throw new AuditValidationException("Report start date must not be after end date");
        }

        List<ReportLine> lines;
        try {
            lines = auditEventStore.aggregate(startDate, endDate);
        } catch (AuditStorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuditStorageException("Failed to aggregate audit records for report " + reportType, e);
        }

        ReportSummary.ReportSummaryBuilder summary = ReportSummary.builder()
            .reportType(reportType)
            .periodStart(startDate)
            .periodEnd(endDate)
            .generatedAt(clock.instant());

        long total = 0;
        long critical = 0;
        long high = 0;
        long violations = 0;
        for (ReportLine line : lines) {
            total += line.getEventCount();
            critical += line.getCriticalCount();
            high += line.getHighCount();
            violations += line.getViolationCount();
            summary.detail(line);
        }

        log.info("Compliance report generated - type: {}, events: {}, violations: {}", reportType, total, violations);
        return summary
            .totalEvents(total)
            .criticalEvents(critical)
            .highEvents(high)
            .violations(violations)
            .build();
    }
}
