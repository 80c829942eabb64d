package com.waqiti.auditpipeline.store;

import com.waqiti.auditpipeline.domain.AuditLogRecord;
import com.waqiti.auditpipeline.exception.AuditStorageException;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditSeverity;
import com.waqiti.auditpipeline.model.AuditTrailFilter;
import com.waqiti.auditpipeline.model.ReportLine;
import com.waqiti.auditpipeline.model.Violation;
import com.waqiti.auditpipeline.repository.AuditLogRepository;
import com.waqiti.auditpipeline.repository.ViolationRepository;
import com.waqiti.auditpipeline.security.SnapshotCipher;
import jakarta.persistence.criteria.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Relational implementation of the audit store on Spring Data JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaAuditEventStore implements AuditEventStore {

    private final AuditLogRepository auditLogRepository;
    private final ViolationRepository violationRepository;
    private final AuditRecordMapper mapper;
    private final SnapshotCipher snapshotCipher;
    private final Clock clock;

    @Override
    @Transactional
    public void append(AuditEvent event) {
        AuditLogRecord record = mapper.toRecord(event, clock.instant());
        try {
            auditLogRepository.save(record);
        } catch (DataAccessException e) {
            throw new AuditStorageException("Failed to store audit event " + event.getRequestId(), e);
        }
    }

    @Override
    @Transactional
    public void appendViolation(Violation violation, String protectedSnapshot) {
        try {
            violationRepository.save(mapper.toRecord(violation, protectedSnapshot, snapshotCipher.isEnabled()));
        } catch (DataAccessException e) {
            throw new AuditStorageException("Failed to store violation for event " + violation.getEventRequestId(), e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEvent> findTrail(String userId, AuditTrailFilter filter, int limit) {
        PageRequest page = PageRequest.of(0, limit, Sort.by(Sort.Direction.DESC, "recordedAt"));
        return auditLogRepository.findAll(trailSpecification(userId, filter), page)
            .getContent()
            .stream()
            .map(mapper::toEvent)
            .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReportLine> aggregate(Instant start, Instant end) {
        return auditLogRepository.aggregateByCategoryAndType(start, end, AuditSeverity.CRITICAL, AuditSeverity.HIGH)
            .stream()
            .map(row -> ReportLine.builder()
                .eventCategory(row.getEventCategory())
                .eventType(row.getEventType())
                .eventCount(nullToZero(row.getEventCount()))
                .criticalCount(nullToZero(row.getCriticalCount()))
                .highCount(nullToZero(row.getHighCount()))
                .violationCount(nullToZero(row.getViolationCount()))
                .build())
            .toList();
    }

    @Override
    @Transactional
    public long deleteExpired(Instant now) {
        try {
            return auditLogRepository.deleteExpired(now);
        } catch (DataAccessException e) {
            throw new AuditStorageException("Retention delete failed", e);
        }
    }

    private static Specification<AuditLogRecord> trailSpecification(String userId, AuditTrailFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("userId"), userId));
            if (filter.getStartDate() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("recordedAt"), filter.getStartDate()));
            }
            if (filter.getEndDate() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.get("recordedAt"), filter.getEndDate()));
            }
            if (!filter.getEventTypes().isEmpty()) {
                predicates.add(root.get("eventType").in(filter.getEventTypes()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    private static long nullToZero(Long value) {
        return value == null ? 0L : value;
    }
}
