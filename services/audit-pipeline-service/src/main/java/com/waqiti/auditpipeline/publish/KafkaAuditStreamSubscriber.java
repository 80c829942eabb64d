package com.waqiti.auditpipeline.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AuditEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Forwards stored audit events to a Kafka topic keyed by request id.
 */
@Component
@ConditionalOnProperty(prefix = "waqiti.audit.pipeline.publishing", name = "kafka-enabled", havingValue = "true")
@Slf4j
public class KafkaAuditStreamSubscriber implements AuditEventSubscriber {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public KafkaAuditStreamSubscriber(KafkaTemplate<String, String> kafkaTemplate,
                                      ObjectMapper objectMapper,
                                      AuditPipelineProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = properties.getPublishing().getTopic();
    }

    @Override
    public String name() {
        return "kafka:" + topic;
    }

    @Override
    public void onEvent(AuditEvent storedEvent) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(storedEvent);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit event not serializable: " + storedEvent.getRequestId(), e);
        }
        kafkaTemplate.send(topic, storedEvent.getRequestId(), payload)
            .whenComplete((result, ex) -> {
                if (ex != null) {
                    log.warn("Failed to publish audit event to Kafka - topic: {}, requestId: {}: {}",
                        topic, storedEvent.getRequestId(), ex.getMessage());
                } else {
                    log.debug("Audit event published - topic: {}, requestId: {}", topic, storedEvent.getRequestId());
                }
            });
    }
}
