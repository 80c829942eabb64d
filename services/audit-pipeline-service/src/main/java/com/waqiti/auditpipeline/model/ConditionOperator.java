package com.waqiti.auditpipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConditionOperator {
    EQUALS,
    CONTAINS,
    GREATER_THAN,
    LESS_THAN,
    REGEX;

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConditionOperator fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
