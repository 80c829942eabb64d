package com.waqiti.auditpipeline.exception;

/**
 * Root of the audit pipeline's error taxonomy.
 * Unchecked; every subtype carries a stable error code for API responses.
 */
public class AuditServiceException extends RuntimeException {

    private final String errorCode;

    public AuditServiceException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public AuditServiceException(String message, String errorCode, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
