package com.waqiti.auditpipeline.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single {@code field operator value} predicate. The field is a dotted path
 * into the audit event, e.g. {@code requestData.amount}.
 */
@Value
@Builder
@Jacksonized
public class RuleCondition {
    String field;
    ConditionOperator operator;
    Object value;
}
