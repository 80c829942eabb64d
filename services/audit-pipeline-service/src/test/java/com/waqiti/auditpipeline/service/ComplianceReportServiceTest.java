package com.waqiti.auditpipeline.service;

import com.waqiti.auditpipeline.exception.AuditValidationException;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import com.waqiti.auditpipeline.model.ReportLine;
import com.waqiti.auditpipeline.model.ReportSummary;
import com.waqiti.auditpipeline.support.InMemoryAuditEventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ComplianceReportService")
class ComplianceReportServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-31T23:00:00Z");
    private static final Instant MAY_START = Instant.parse("2026-05-01T00:00:00Z");

    private InMemoryAuditEventStore store;
    private ComplianceReportService reportService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new InMemoryAuditEventStore(clock);
        reportService = new ComplianceReportService(store, clock);
    }

    private static AuditEvent event(String type, AuditEventCategory category, AuditSeverity severity, boolean flagged) {
        return AuditEvent.builder()
            .eventType(type)
            .eventCategory(category)
            .description(type)
            .severity(severity)
            .complianceFlags(flagged ? List.of("RULE") : List.of())
            .build();
    }

    @Test
    @DisplayName("Should count events, severities and violations per category and type")
    void shouldAggregateWindow() {
        // Given
        Instant inWindow = Instant.parse("2026-05-10T12:00:00Z");
        store.seed(event("WIRE_TRANSFER", AuditEventCategory.FINANCIAL_TRANSACTION, AuditSeverity.CRITICAL, true), inWindow);
        store.seed(event("WIRE_TRANSFER", AuditEventCategory.FINANCIAL_TRANSACTION, AuditSeverity.HIGH, false), inWindow);
        store.seed(event("LOGIN_SUCCEEDED", AuditEventCategory.AUTHENTICATION, AuditSeverity.LOW, false), inWindow);
        store.seed(event("WIRE_TRANSFER", AuditEventCategory.FINANCIAL_TRANSACTION, AuditSeverity.CRITICAL, true),
            Instant.parse("2026-04-30T23:59:59Z"));

        // When
        ReportSummary report = reportService.generate("monthly", MAY_START, NOW);

        // Then
        assertThat(report.getTotalEvents()).isEqualTo(3);
        assertThat(report.getCriticalEvents()).isEqualTo(1);
        assertThat(report.getHighEvents()).isEqualTo(1);
        assertThat(report.getViolations()).isEqualTo(1);
        assertThat(report.getGeneratedAt()).isEqualTo(NOW);
        assertThat(report.getDetails())
            .filteredOn(line -> line.getEventType().equals("WIRE_TRANSFER"))
            .singleElement()
            .extracting(ReportLine::getEventCount)
            .isEqualTo(2L);
    }

    @Test
    @DisplayName("Should return a zero-filled summary for an empty window")
    void shouldReturnZeroFilledSummary() {
        ReportSummary report = reportService.generate("daily", MAY_START, MAY_START.plusSeconds(86_400));

        assertThat(report.getTotalEvents()).isZero();
        assertThat(report.getCriticalEvents()).isZero();
        assertThat(report.getHighEvents()).isZero();
        assertThat(report.getViolations()).isZero();
        assertThat(report.getDetails()).isEmpty();
        assertThat(report.getReportType()).isEqualTo("daily");
    }

    @Test
    @DisplayName("Should reject an inverted or incomplete window")
    void shouldRejectInvalidWindow() {
        assertThatThrownBy(() -> reportService.generate("daily", NOW, MAY_START))
            .isInstanceOf(AuditValidationException.class);
        assertThatThrownBy(() -> reportService.generate("daily", null, NOW))
            .isInstanceOf(AuditValidationException.class);
        assertThatThrownBy(() -> reportService.generate(" ", MAY_START, NOW))
            .isInstanceOf(AuditValidationException.class);
    }
}
