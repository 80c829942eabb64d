package com.waqiti.auditpipeline.dispatch;

import com.waqiti.auditpipeline.client.NotificationRequest;
import com.waqiti.auditpipeline.client.NotificationServiceClient;
import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AlertChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class SmsAlertSender implements AlertChannelSender {

    private final NotificationServiceClient notificationServiceClient;
    private final AuditPipelineProperties properties;

    @Override
    public AlertChannel channel() {
        return AlertChannel.SMS;
    }

    @Override
    public void deliver(AlertPayload payload) {
        List<String> recipients = properties.getAlerts().getSmsRecipients();
        if (recipients.isEmpty()) {
            throw new IllegalStateException("No compliance SMS recipients configured");
        }
        // SMS carries the subject line only
        notificationServiceClient.sendNotification(NotificationRequest.builder()
            .channel(NotificationRequest.Channel.SMS)
            .recipients(recipients)
            .message(payload.subject())
            .priority(payload.getSeverity().name())
            .correlationId(payload.getEventRequestId())
            .build());
    }
}
