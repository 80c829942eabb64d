package com.waqiti.auditpipeline.exception;

/**
 * The rule store could not be read. Recovered locally: the previously
 * loaded rule snapshot stays in force.
 */
public class RuleLoadException extends AuditServiceException {

    public static final String ERROR_CODE = "RULE_LOAD_FAILED";

    public RuleLoadException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
