package com.waqiti.auditpipeline.enrichment;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AuditEvent;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Keyword based detection of personal and sensitive financial data.
 *
 * <p>The scan walks the caller supplied fields of an event, field names
 * included, and descends into payload maps and lists. Pipeline owned fields
 * (flags, retention) are never part of the scan.
 */
@Component
public class DataSensitivityClassifier {

    private final List<String> personalDataKeywords;
    private final List<String> sensitiveDataKeywords;

    public DataSensitivityClassifier(AuditPipelineProperties properties) {
        this(properties.getDetection().getPersonalDataKeywords(),
             properties.getDetection().getSensitiveDataKeywords());
    }

    DataSensitivityClassifier(List<String> personalDataKeywords, List<String> sensitiveDataKeywords) {
        this.personalDataKeywords = normalize(personalDataKeywords);
        this.sensitiveDataKeywords = normalize(sensitiveDataKeywords);
    }

    public boolean containsPersonalData(AuditEvent event) {
        return matchesAny(scanText(event), personalDataKeywords);
    }

    public boolean containsSensitiveData(AuditEvent event) {
        return matchesAny(scanText(event), sensitiveDataKeywords);
    }

    /**
     * Flattens the event into lower-case text, one {@code name value} pair per present field.
     */
    String scanText(AuditEvent event) {
        StringBuilder text = new StringBuilder(256);
        append(text, "requestId", event.getRequestId());
        append(text, "timestamp", event.getTimestamp());
        append(text, "eventType", event.getEventType());
        append(text, "eventCategory", event.getEventCategory() == null ? null : event.getEventCategory().getCode());
        append(text, "description", event.getDescription());
        append(text, "userId", event.getUserId());
        append(text, "userEmail", event.getUserEmail());
        append(text, "sessionId", event.getSessionId());
        append(text, "ipAddress", event.getIpAddress());
        append(text, "userAgent", event.getUserAgent());
        append(text, "endpoint", event.getEndpoint());
        append(text, "httpMethod", event.getHttpMethod());
        append(text, "resourceType", event.getResourceType());
        append(text, "resourceId", event.getResourceId());
        append(text, "amount", event.getAmount());
        append(text, "currency", event.getCurrency());
        append(text, "productId", event.getProductId());
        append(text, "institutionId", event.getInstitutionId());
        append(text, "requestData", event.getRequestData());
        append(text, "responseData", event.getResponseData());
        append(text, "responseStatus", event.getResponseStatus());
        append(text, "severity", event.getSeverity());
        append(text, "riskScore", event.getRiskScore());
        append(text, "error", event.getError());
        append(text, "errorCode", event.getErrorCode());
        append(text, "stackTrace", event.getStackTrace());
        append(text, "metadata", event.getMetadata());
        return text.toString().toLowerCase(Locale.ROOT);
    }

    private void append(StringBuilder text, String name, Object value) {
        if (value == null) {
            return;
        }
        text.append(name).append(' ');
        appendValue(text, value);
        text.append('\n');
    }

    private void appendValue(StringBuilder text, Object value) {
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                text.append(entry.getKey()).append(' ');
                appendValue(text, entry.getValue());
                text.append(' ');
            }
        } else if (value instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null) {
                    appendValue(text, item);
                    text.append(' ');
                }
            }
        } else {
            text.append(value);
        }
    }

    private static boolean matchesAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalize(List<String> keywords) {
        return keywords.stream()
            .filter(Objects::nonNull)
            .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
            .filter(keyword -> !keyword.isEmpty())
            .toList();
    }
}
