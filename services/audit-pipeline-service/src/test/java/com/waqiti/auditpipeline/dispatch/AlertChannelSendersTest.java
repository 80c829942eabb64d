package com.waqiti.auditpipeline.dispatch;

import com.waqiti.auditpipeline.client.NotificationRequest;
import com.waqiti.auditpipeline.client.NotificationServiceClient;
import com.waqiti.auditpipeline.client.SlackClient;
import com.waqiti.auditpipeline.client.SlackMessage;
import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import com.waqiti.auditpipeline.model.ComplianceRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("Alert channel senders")
class AlertChannelSendersTest {

    @Mock
    private NotificationServiceClient notificationServiceClient;

    @Mock
    private SlackClient slackClient;

    @Mock
    private RestTemplate restTemplate;

    @Captor
    private ArgumentCaptor<NotificationRequest> notificationCaptor;

    private AuditPipelineProperties properties;
    private AlertPayload payload;

    @BeforeEach
    void setUp() {
        properties = new AuditPipelineProperties();
        AuditEvent event = AuditEvent.builder()
            .requestId("req-5")
            .timestamp(Instant.parse("2026-02-02T10:00:00Z"))
            .eventType("WIRE_TRANSFER")
            .eventCategory(AuditEventCategory.FINANCIAL_TRANSACTION)
            .description("Outbound wire")
            .userId("user-3")
            .requestData(Map.of("cardNumber", "4111111111111111"))
            .build();
        ComplianceRule rule = ComplianceRule.builder()
            .id("rule-5").name("LARGE_TRANSFER").eventType("WIRE_TRANSFER").severity(AuditSeverity.HIGH).build();
        payload = AlertPayload.of(event, rule);
    }

    @Test
    @DisplayName("Should send an e-mail alert without payload contents")
    void shouldSendEmail() {
        properties.getAlerts().setEmailRecipients(List.of("compliance@waqiti.com"));

        new EmailAlertSender(notificationServiceClient, properties).deliver(payload);

        verify(notificationServiceClient).sendNotification(notificationCaptor.capture());
        NotificationRequest request = notificationCaptor.getValue();
        assertThat(request.getChannel()).isEqualTo(NotificationRequest.Channel.EMAIL);
        assertThat(request.getRecipients()).containsExactly("compliance@waqiti.com");
        assertThat(request.getSubject()).contains("LARGE_TRANSFER").contains("WIRE_TRANSFER");
        assertThat(request.getMessage()).contains("user-3").doesNotContain("4111111111111111");
        assertThat(request.getPriority()).isEqualTo("HIGH");
    }

    @Test
    @DisplayName("Should fail when no e-mail or SMS recipients are configured")
    void shouldFailWithoutRecipients() {
        assertThatThrownBy(() -> new EmailAlertSender(notificationServiceClient, properties).deliver(payload))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new SmsAlertSender(notificationServiceClient, properties).deliver(payload))
            .isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(notificationServiceClient);
    }

    @Test
    @DisplayName("Should send an SMS with the subject line only")
    void shouldSendSms() {
        properties.getAlerts().setSmsRecipients(List.of("+525555555555"));

        new SmsAlertSender(notificationServiceClient, properties).deliver(payload);

        verify(notificationServiceClient).sendNotification(notificationCaptor.capture());
        assertThat(notificationCaptor.getValue().getChannel()).isEqualTo(NotificationRequest.Channel.SMS);
        assertThat(notificationCaptor.getValue().getMessage()).isEqualTo(payload.subject());
    }

    @Test
    @DisplayName("Should post Slack alerts to the configured channel")
    void shouldPostToSlack() {
        new SlackAlertSender(slackClient, properties).deliver(payload);

        ArgumentCaptor<SlackMessage> message = ArgumentCaptor.forClass(SlackMessage.class);
        verify(slackClient).postMessage(message.capture());
        assertThat(message.getValue().getChannel()).isEqualTo("#compliance-alerts");
        assertThat(message.getValue().getText()).contains("LARGE_TRANSFER");
    }

    @Test
    @DisplayName("Should post webhook alerts only when a URL is configured")
    void shouldPostWebhook() {
        WebhookAlertSender sender = new WebhookAlertSender(restTemplate, properties);
        assertThatThrownBy(() -> sender.deliver(payload)).isInstanceOf(IllegalStateException.class);

        properties.getAlerts().setWebhookUrl("https://hooks.example.com/compliance");
        sender.deliver(payload);

        verify(restTemplate).postForEntity(eq("https://hooks.example.com/compliance"), eq(payload), eq(Void.class));
    }
}
