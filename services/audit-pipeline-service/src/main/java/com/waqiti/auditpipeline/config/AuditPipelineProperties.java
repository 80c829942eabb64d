package com.waqiti.auditpipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "waqiti.audit.pipeline")
public class AuditPipelineProperties {

    private String serverId = "audit-pipeline-1";
    private String environment = "production";

    private RetentionProperties retention = new RetentionProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private AutoResponseProperties autoResponse = new AutoResponseProperties();
    private DetectionProperties detection = new DetectionProperties();
    private RedactionProperties redaction = new RedactionProperties();
    private SecurityProperties security = new SecurityProperties();
    private PublishingProperties publishing = new PublishingProperties();
    private AlertProperties alerts = new AlertProperties();
    private TrailProperties trail = new TrailProperties();

    @Data
    public static class RetentionProperties {
        private boolean enabled = true;
        private Duration sweepInterval = Duration.ofHours(24);
        private Duration initialDelay = Duration.ofMinutes(5);
    }

    @Data
    public static class DispatchProperties {
        private Duration timeout = Duration.ofSeconds(30);
        private int poolSize = 8;
    }

    @Data
    public static class AutoResponseProperties {
        /**
         * Floor applied to the actor's risk score by {@code flag_account}.
         */
        private int flagRiskScore = 80;
    }

    @Data
    public static class DetectionProperties {
        private List<String> personalDataKeywords = new ArrayList<>(List.of(
            "curp", "rfc", "email", "phone", "address", "name",
            "birth", "ssn", "passport", "license"));
        private List<String> sensitiveDataKeywords = new ArrayList<>(List.of(
            "account", "card", "balance", "transaction", "payment",
            "credit", "loan", "score", "income", "salary"));
    }

    @Data
    public static class RedactionProperties {
        private List<String> fields = new ArrayList<>(List.of(
            "curp", "rfc", "email", "phone", "accountNumber", "cardNumber"));
        private String marker = "***ENCRYPTED***";
    }

    @Data
    public static class SecurityProperties {
        /**
         * Base64 encoded 256-bit AES key for violation snapshots.
         */
        private String snapshotKey;
    }

    @Data
    public static class PublishingProperties {
        private int queueCapacity = 10_000;
        private boolean kafkaEnabled = true;
        private String topic = "compliance-audit-events";
    }

    @Data
    public static class AlertProperties {
        private List<String> emailRecipients = new ArrayList<>();
        private List<String> smsRecipients = new ArrayList<>();
        private String slackChannel = "#compliance-alerts";
        private String webhookUrl;
    }

    @Data
    public static class TrailProperties {
        private int maxResults = 1000;
    }
}
