package com.waqiti.auditpipeline.dispatch;

import com.waqiti.auditpipeline.client.SlackClient;
import com.waqiti.auditpipeline.client.SlackMessage;
import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AlertChannel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SlackAlertSender implements AlertChannelSender {

    private final SlackClient slackClient;
    private final AuditPipelineProperties properties;

    @Override
    public AlertChannel channel() {
        return AlertChannel.SLACK;
    }

    @Override
    public void deliver(AlertPayload payload) {
        slackClient.postMessage(SlackMessage.builder()
            .channel(properties.getAlerts().getSlackChannel())
            .text(payload.summary())
            .build());
    }
}
