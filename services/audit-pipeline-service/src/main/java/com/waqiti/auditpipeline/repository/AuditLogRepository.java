package com.waqiti.auditpipeline.repository;

import com.waqiti.auditpipeline.domain.AuditLogRecord;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogRecord, UUID>,
        JpaSpecificationExecutor<AuditLogRecord> {

    interface CategoryTypeCounts {
        AuditEventCategory getEventCategory();
        String getEventType();
        Long getEventCount();
        Long getCriticalCount();
        Long getHighCount();
        Long getViolationCount();
    }

    /**
     * Report aggregation over records stored within the window.
     */
    @Query("SELECT a.eventCategory AS eventCategory, a.eventType AS eventType, COUNT(a) AS eventCount, " +
           "SUM(CASE WHEN a.severity = :critical THEN 1L ELSE 0L END) AS criticalCount, " +
           "SUM(CASE WHEN a.severity = :high THEN 1L ELSE 0L END) AS highCount, " +
           "SUM(CASE WHEN a.complianceFlags IS NOT NULL THEN 1L ELSE 0L END) AS violationCount " +
           "FROM AuditLogRecord a WHERE a.recordedAt BETWEEN :startDate AND :endDate " +
           "GROUP BY a.eventCategory, a.eventType ORDER BY COUNT(a) DESC")
    List<CategoryTypeCounts> aggregateByCategoryAndType(@Param("startDate") Instant startDate,
                                                        @Param("endDate") Instant endDate,
                                                        @Param("critical") AuditSeverity critical,
                                                        @Param("high") AuditSeverity high);

    /**
     * Retention sweep; records under retention are never touched.
     */
    @Modifying
    @Query("DELETE FROM AuditLogRecord a WHERE a.requiresRetention = false AND a.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}
