package com.waqiti.auditpipeline.exception;

/**
 * The durable write of an audit record failed. This is the only failure a
 * {@code logEvent} caller sees after validation has passed.
 */
public class AuditStorageException extends AuditServiceException {

    public static final String ERROR_CODE = "AUDIT_STORAGE_FAILED";

    public AuditStorageException(String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
    }
}
