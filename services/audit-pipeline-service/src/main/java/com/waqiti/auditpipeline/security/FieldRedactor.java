package com.waqiti.auditpipeline.security;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces a fixed list of sensitive keys in a payload with a marker.
 * Shallow (top level only) and idempotent.
 */
@Component
public class FieldRedactor {

    private final List<String> redactedFields;
    private final String marker;

    @Autowired
    public FieldRedactor(AuditPipelineProperties properties) {
        this(properties.getRedaction().getFields(), properties.getRedaction().getMarker());
    }

    public FieldRedactor(List<String> redactedFields, String marker) {
        this.redactedFields = List.copyOf(redactedFields);
        this.marker = marker;
    }

    public Map<String, Object> redact(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return payload;
        }
        Map<String, Object> redacted = new LinkedHashMap<>(payload);
        for (String field : redactedFields) {
            if (isPresent(redacted.get(field))) {
                redacted.put(field, marker);
            }
        }
        return redacted;
    }

    public String getMarker() {
        return marker;
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof CharSequence text) {
            return !text.isEmpty();
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof Number number) {
            return number.doubleValue() != 0d;
        }
        return true;
    }
}
