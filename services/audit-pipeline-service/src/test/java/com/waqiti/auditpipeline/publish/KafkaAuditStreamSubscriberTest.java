package com.waqiti.auditpipeline.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("KafkaAuditStreamSubscriber")
class KafkaAuditStreamSubscriberTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Test
    @DisplayName("Should publish the stored event as JSON keyed by request id")
    void shouldPublishStoredEvent() {
        // Given
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
            .thenReturn(CompletableFuture.completedFuture(null));
        KafkaAuditStreamSubscriber subscriber = new KafkaAuditStreamSubscriber(
            kafkaTemplate, new ObjectMapper().findAndRegisterModules(), new AuditPipelineProperties());
        AuditEvent stored = AuditEvent.builder()
            .requestId("req-31")
            .timestamp(Instant.parse("2026-03-01T00:00:00Z"))
            .eventType("WIRE_TRANSFER")
            .eventCategory(AuditEventCategory.FINANCIAL_TRANSACTION)
            .description("Wire")
            .complianceFlags(List.of("LARGE_TRANSFER"))
            .build();

        // When
        subscriber.onEvent(stored);

        // Then
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("compliance-audit-events"), eq("req-31"), payload.capture());
        assertThat(payload.getValue())
            .contains("\"eventType\":\"WIRE_TRANSFER\"")
            .contains("\"eventCategory\":\"financial_transaction\"")
            .contains("LARGE_TRANSFER");
        assertThat(subscriber.name()).isEqualTo("kafka:compliance-audit-events");
    }
}
