package com.waqiti.auditpipeline.exception;

/**
 * Thrown synchronously, before any I/O, when an event or query is malformed.
 */
public class AuditValidationException extends AuditServiceException {

    public static final String ERROR_CODE = "AUDIT_VALIDATION_FAILED";

    public AuditValidationException(String message) {
        super(message, ERROR_CODE);
    }
}
