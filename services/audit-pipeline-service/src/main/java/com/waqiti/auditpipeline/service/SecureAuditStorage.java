package com.waqiti.auditpipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waqiti.auditpipeline.exception.AuditStorageException;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.Violation;
import com.waqiti.auditpipeline.security.FieldRedactor;
import com.waqiti.auditpipeline.security.IpAddressHasher;
import com.waqiti.auditpipeline.security.SnapshotCipher;
import com.waqiti.auditpipeline.store.AuditEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Prepares events for storage and appends them to the durable store.
 *
 * <p>Payloads of events flagged as carrying personal data are redacted and
 * the IP address is replaced by its hash. Any write failure surfaces as
 * {@link AuditStorageException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SecureAuditStorage {

    private final AuditEventStore auditEventStore;
    private final FieldRedactor fieldRedactor;
    private final IpAddressHasher ipAddressHasher;
    private final SnapshotCipher snapshotCipher;
    private final ObjectMapper objectMapper;

    /**
     * @return the event exactly as it was persisted
     */
    public AuditEvent store(AuditEvent event) {
        AuditEvent secured = prepareForStorage(event);
        try {
            auditEventStore.append(secured);
        } catch (AuditStorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuditStorageException("Failed to store audit event " + event.getRequestId(), e);
        }
        log.debug("Audit event stored - requestId: {}, type: {}", secured.getRequestId(), secured.getEventType());
        return secured;
    }

    public void storeViolation(Violation violation) {
        AuditEvent snapshot = prepareForStorage(violation.getEventSnapshot());
        String protectedSnapshot;
        try {
            protectedSnapshot = snapshotCipher.encrypt(objectMapper.writeValueAsString(snapshot));
        } catch (JsonProcessingException e) {
            throw new AuditStorageException("Violation snapshot is not serializable", e);
        }
        try {
            auditEventStore.appendViolation(violation, protectedSnapshot);
        } catch (AuditStorageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AuditStorageException("Failed to store violation for event " + violation.getEventRequestId(), e);
        }
    }

    AuditEvent prepareForStorage(AuditEvent event) {
        AuditEvent.AuditEventBuilder builder = event.toBuilder();
        if (event.isPersonalDataIncluded()) {
            builder.requestData(fieldRedactor.redact(event.getRequestData()))
                .responseData(fieldRedactor.redact(event.getResponseData()));
        }
        if (event.getIpAddress() != null) {
            builder.ipAddress(ipAddressHasher.hash(event.getIpAddress()));
        }
        return builder.build();
    }
}
