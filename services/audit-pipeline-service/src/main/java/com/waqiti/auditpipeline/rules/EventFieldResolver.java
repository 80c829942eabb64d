package com.waqiti.auditpipeline.rules;

import com.waqiti.auditpipeline.model.AuditEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Resolves dotted field paths such as {@code severity} or
 * {@code requestData.beneficiary.country} against an audit event.
 * An unknown or missing path resolves to {@code null}; resolution never throws.
 */
@Component
public class EventFieldResolver {

    public Object resolve(AuditEvent event, String path) {
        if (event == null || path == null || path.isBlank()) {
            return null;
        }
        String[] segments = path.split("\\.");
        Object current = topLevel(event, segments[0]);
        for (int i = 1; i < segments.length && current != null; i++) {
            current = child(current, segments[i]);
        }
        return current;
    }

    private Object topLevel(AuditEvent event, String field) {
        return switch (field) {
            case "requestId" -> event.getRequestId();
            case "timestamp" -> event.getTimestamp() == null ? null : event.getTimestamp().toString();
            case "eventType" -> event.getEventType();
            case "eventCategory" -> event.getEventCategory() == null ? null : event.getEventCategory().getCode();
            case "description" -> event.getDescription();
            case "userId" -> event.getUserId();
            case "userEmail" -> event.getUserEmail();
            case "sessionId" -> event.getSessionId();
            case "ipAddress" -> event.getIpAddress();
            case "userAgent" -> event.getUserAgent();
            case "endpoint" -> event.getEndpoint();
            case "httpMethod" -> event.getHttpMethod();
            case "resourceType" -> event.getResourceType();
            case "resourceId" -> event.getResourceId();
            case "amount" -> event.getAmount();
            case "currency" -> event.getCurrency();
            case "productId" -> event.getProductId();
            case "institutionId" -> event.getInstitutionId();
            case "requestData" -> event.getRequestData();
            case "responseData" -> event.getResponseData();
            case "responseStatus" -> event.getResponseStatus();
            case "severity" -> event.getSeverity() == null ? null : event.getSeverity().name();
            case "riskScore" -> event.getRiskScore();
            case "complianceFlags" -> event.getComplianceFlags();
            case "error" -> event.getError();
            case "errorCode" -> event.getErrorCode();
            case "metadata" -> event.getMetadata();
            case "serverId" -> event.getServerId();
            case "environment" -> event.getEnvironment();
            case "requiresRetention" -> event.getRequiresRetention();
            case "retentionYears" -> event.getRetentionYears();
            case "personalDataIncluded" -> event.isPersonalDataIncluded();
            case "sensitiveDataIncluded" -> event.isSensitiveDataIncluded();
            default -> null;
        };
    }

    private Object child(Object parent, String segment) {
        if (parent instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (parent instanceof List<?> list) {
            try {
                int index = Integer.parseInt(segment);
                return index >= 0 && index < list.size() ? list.get(index) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
