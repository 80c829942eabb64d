package com.waqiti.auditpipeline.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRequest {

    public enum Channel {
        EMAIL,
        SMS
    }

    private Channel channel;
    private List<String> recipients;
    private String subject;
    private String message;
    private String priority;
    private String correlationId;
    private Map<String, Object> metadata;
}
