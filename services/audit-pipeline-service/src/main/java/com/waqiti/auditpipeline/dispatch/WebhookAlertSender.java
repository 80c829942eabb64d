package com.waqiti.auditpipeline.dispatch;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AlertChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Posts the alert payload as JSON to the configured generic webhook.
 */
@Component
@RequiredArgsConstructor
public class WebhookAlertSender implements AlertChannelSender {

    private final RestTemplate alertRestTemplate;
    private final AuditPipelineProperties properties;

    @Override
    public AlertChannel channel() {
        return AlertChannel.WEBHOOK;
    }

    @Override
    public void deliver(AlertPayload payload) {
        String url = properties.getAlerts().getWebhookUrl();
        if (url == null || url.isBlank()) {
            throw new IllegalStateException("No compliance webhook URL configured");
        }
        alertRestTemplate.postForEntity(url, payload, Void.class);
    }
}
