package com.waqiti.auditpipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AutoResponseAction {
    BLOCK_USER(true),
    FLAG_ACCOUNT(true),
    NOTIFY_COMPLIANCE(false),
    CREATE_TICKET(false);

    private final boolean userScoped;

    AutoResponseAction(boolean userScoped) {
        this.userScoped = userScoped;
    }

    /**
     * Whether the action targets the actor's account and therefore needs a user id.
     */
    public boolean isUserScoped() {
        return userScoped;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AutoResponseAction fromCode(String code) {
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
