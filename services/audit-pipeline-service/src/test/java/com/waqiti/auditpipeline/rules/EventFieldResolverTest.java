package com.waqiti.auditpipeline.rules;

import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("EventFieldResolver")
class EventFieldResolverTest {

    private final EventFieldResolver resolver = new EventFieldResolver();

    private final AuditEvent event = AuditEvent.builder()
        .eventType("WIRE_TRANSFER")
        .eventCategory(AuditEventCategory.FINANCIAL_TRANSACTION)
        .description("Outbound wire")
        .severity(AuditSeverity.HIGH)
        .amount(new BigDecimal("75000"))
        .requestData(Map.of(
            "beneficiary", Map.of("country", "KY"),
            "legs", List.of(Map.of("bank", "A"), Map.of("bank", "B"))))
        .build();

    @Test
    @DisplayName("Should resolve top level fields")
    void shouldResolveTopLevel() {
        assertThat(resolver.resolve(event, "amount")).isEqualTo(new BigDecimal("75000"));
        assertThat(resolver.resolve(event, "severity")).isEqualTo("HIGH");
        assertThat(resolver.resolve(event, "eventCategory")).isEqualTo("financial_transaction");
    }

    @Test
    @DisplayName("Should resolve nested map and list paths")
    void shouldResolveNestedPaths() {
        assertThat(resolver.resolve(event, "requestData.beneficiary.country")).isEqualTo("KY");
        assertThat(resolver.resolve(event, "requestData.legs.1.bank")).isEqualTo("B");
    }

    @Test
    @DisplayName("Should resolve missing paths to null")
    void shouldResolveMissingToNull() {
        assertThat(resolver.resolve(event, "requestData.beneficiary.city")).isNull();
        assertThat(resolver.resolve(event, "requestData.legs.7.bank")).isNull();
        assertThat(resolver.resolve(event, "amount.scale")).isNull();
        assertThat(resolver.resolve(event, "unknownField")).isNull();
        assertThat(resolver.resolve(event, "responseData.status")).isNull();
        assertThat(resolver.resolve(event, "")).isNull();
    }
}
