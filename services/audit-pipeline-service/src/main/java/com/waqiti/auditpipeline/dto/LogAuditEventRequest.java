package com.waqiti.auditpipeline.dto;

import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Audit event submitted over HTTP. Pipeline-owned fields (flags, sensitivity,
 * server identity) are not accepted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LogAuditEventRequest {

    @NotBlank(message = "Event type is required")
    @Size(max = 100)
    private String eventType;

    @NotNull(message = "Event category is required")
    private AuditEventCategory eventCategory;

    @NotBlank(message = "Description is required")
    @Size(max = 2000)
    private String description;

    private String requestId;
    private String userId;
    private String userEmail;
    private String sessionId;
    private String ipAddress;
    private String userAgent;
    private String endpoint;
    private String httpMethod;

    private String resourceType;
    private String resourceId;
    private BigDecimal amount;
    private String currency;
    private String productId;
    private String institutionId;

    private Map<String, Object> requestData;
    private Map<String, Object> responseData;
    private Integer responseStatus;

    private AuditSeverity severity;

    @Min(0)
    @Max(100)
    private Integer riskScore;

    private String error;
    private String errorCode;
    private Map<String, Object> metadata;

    private Boolean requiresRetention;
    private Integer retentionYears;

    public AuditEvent toAuditEvent() {
        return AuditEvent.builder()
            .requestId(requestId)
            .eventType(eventType)
            .eventCategory(eventCategory)
            .description(description)
            .userId(userId)
            .userEmail(userEmail)
            .sessionId(sessionId)
            .ipAddress(ipAddress)
            .userAgent(userAgent)
            .endpoint(endpoint)
            .httpMethod(httpMethod)
            .resourceType(resourceType)
            .resourceId(resourceId)
            .amount(amount)
            .currency(currency)
            .productId(productId)
            .institutionId(institutionId)
            .requestData(requestData)
            .responseData(responseData)
            .responseStatus(responseStatus)
            .severity(severity)
            .riskScore(riskScore)
            .error(error)
            .errorCode(errorCode)
            .metadata(metadata)
            .requiresRetention(requiresRetention)
            .retentionYears(retentionYears)
            .build();
    }
}
