package com.waqiti.auditpipeline.dispatch;

import com.waqiti.auditpipeline.client.NotificationRequest;
import com.waqiti.auditpipeline.client.NotificationServiceClient;
import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AlertChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class EmailAlertSender implements AlertChannelSender {

    private final NotificationServiceClient notificationServiceClient;
    private final AuditPipelineProperties properties;

    @Override
    public AlertChannel channel() {
        return AlertChannel.EMAIL;
    }

    @Override
    public void deliver(AlertPayload payload) {
        List<String> recipients = properties.getAlerts().getEmailRecipients();
        if (recipients.isEmpty()) {
            throw new IllegalStateException("No compliance e-mail recipients configured");
        }
        notificationServiceClient.sendNotification(NotificationRequest.builder()
            .channel(NotificationRequest.Channel.EMAIL)
            .recipients(recipients)
            .subject(payload.subject())
            .message(payload.summary())
            .priority(payload.getSeverity().name())
            .correlationId(payload.getEventRequestId())
            .metadata(Map.of("ruleId", String.valueOf(payload.getRuleId())))
            .build());
    }
}
