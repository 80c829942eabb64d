package com.waqiti.auditpipeline.store;

import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditTrailFilter;
import com.waqiti.auditpipeline.model.ReportLine;
import com.waqiti.auditpipeline.model.Violation;

import java.time.Instant;
import java.util.List;

/**
 * Durable, append-only store of audit records.
 *
 * <p>Records are never updated. The only deletion path is
 * {@link #deleteExpired(Instant)}, used by the retention sweep. Implementations
 * report any write failure as {@link com.waqiti.auditpipeline.exception.AuditStorageException}.
 */
public interface AuditEventStore {

    /**
     * Appends an event already prepared for storage (redacted, IP hashed).
     */
    void append(AuditEvent event);

    void appendViolation(Violation violation, String protectedSnapshot);

    /**
     * Newest first, at most {@code limit} records.
     */
    List<AuditEvent> findTrail(String userId, AuditTrailFilter filter, int limit);

    /**
     * Counts grouped by category and event type for records stored within {@code [start, end]}.
     */
    List<ReportLine> aggregate(Instant start, Instant end);

    /**
     * Deletes records with {@code requiresRetention = false} whose retention period
     * has elapsed at {@code now}.
     *
     * @return number of deleted records
     */
    long deleteExpired(Instant now);
}
