package com.waqiti.auditpipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
public class AutoResponse {
    AutoResponseAction action;

    @Singular
    Map<String, Object> parameters;
}
