package com.waqiti.auditpipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Closed set of audit event categories. Each category carries the number of
 * years its records are kept when the caller does not specify a retention.
 */
public enum AuditEventCategory {

    AUTHENTICATION("authentication", 3),
    AUTHORIZATION("authorization", 5),
    DATA_ACCESS("data_access", 7),
    DATA_MODIFICATION("data_modification", 5),
    FINANCIAL_TRANSACTION("financial_transaction", 10),
    CREDIT_INQUIRY("credit_inquiry", 6),
    KYC("kyc", 7),
    COMPLIANCE("compliance", 10),
    SECURITY("security", 7),
    EXTERNAL_API("external_api", 5),
    SYSTEM_OPERATION("system_operation", 5),
    BUSINESS_OPERATION("business_operation", 5),
    PRIVACY("privacy", 7),
    FRAUD_DETECTION("fraud_detection", 10),
    PERFORMANCE("performance", 5),
    ERROR("error", 5);

    private final String code;
    private final int defaultRetentionYears;

    AuditEventCategory(String code, int defaultRetentionYears) {
        this.code = code;
        this.defaultRetentionYears = defaultRetentionYears;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Retention policy for the category, used only when the caller did not
     * supply a retention period.
     */
    public int getDefaultRetentionYears() {
        return defaultRetentionYears;
    }

    @JsonCreator
    public static AuditEventCategory fromCode(String code) {
        if (code == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(category -> category.code.equalsIgnoreCase(code) || category.name().equalsIgnoreCase(code))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown audit event category: " + code));
    }
}
