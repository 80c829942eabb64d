package com.waqiti.auditpipeline.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waqiti.auditpipeline.domain.AuditLogRecord;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AuditRecordMapper")
class AuditRecordMapperTest {

    private final AuditRecordMapper mapper = new AuditRecordMapper(new ObjectMapper().findAndRegisterModules());

    private static final Instant RECORDED = Instant.parse("2024-02-29T08:00:00Z");

    @Test
    @DisplayName("Should compute expiry from record time and retention years")
    void shouldComputeExpiry() {
        AuditEvent event = AuditEvent.builder()
            .requestId("req-1")
            .eventType("LOGIN_SUCCEEDED")
            .eventCategory(AuditEventCategory.AUTHENTICATION)
            .description("User logged in")
            .severity(AuditSeverity.LOW)
            .requiresRetention(false)
            .retentionYears(3)
            .build();

        AuditLogRecord record = mapper.toRecord(event, RECORDED);

        assertThat(record.getRecordedAt()).isEqualTo(RECORDED);
        assertThat(record.getExpiresAt()).isEqualTo(Instant.parse("2027-02-28T08:00:00Z"));
        assertThat(record.isRequiresRetention()).isFalse();
        assertThat(record.getComplianceFlags()).isNull();
    }

    @Test
    @DisplayName("Should restore payloads and flags from stored JSON")
    void shouldRestoreEvent() {
        AuditEvent event = AuditEvent.builder()
            .requestId("req-2")
            .eventType("WIRE_TRANSFER")
            .eventCategory(AuditEventCategory.FINANCIAL_TRANSACTION)
            .description("Wire")
            .severity(AuditSeverity.HIGH)
            .ipAddress("12ca17b49af22894")
            .requestData(Map.of("cardNumber", "***ENCRYPTED***"))
            .complianceFlags(List.of("LARGE_TRANSFER"))
            .retentionYears(10)
            .requiresRetention(true)
            .build();

        AuditEvent restored = mapper.toEvent(mapper.toRecord(event, RECORDED));

        assertThat(restored.getComplianceFlags()).containsExactly("LARGE_TRANSFER");
        assertThat(restored.getRequestData()).containsEntry("cardNumber", "***ENCRYPTED***");
        assertThat(restored.getIpAddress()).isEqualTo("12ca17b49af22894");
        assertThat(restored.getRetentionYears()).isEqualTo(10);
    }
}
