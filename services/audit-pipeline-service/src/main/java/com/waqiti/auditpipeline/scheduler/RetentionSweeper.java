package com.waqiti.auditpipeline.scheduler;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import com.waqiti.auditpipeline.service.AuditPipelineService;
import com.waqiti.auditpipeline.service.PipelineMetrics;
import com.waqiti.auditpipeline.store.AuditEventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodically deletes audit records whose retention period has elapsed.
 *
 * <p>Only records stored with {@code requiresRetention = false} are eligible;
 * retained records are never touched. Runs on its own scheduler thread, at
 * most one sweep at a time.
 */
@Component
@Slf4j
public class RetentionSweeper implements SmartLifecycle {

    static final String CLEANUP_EVENT_TYPE = "AUDIT_LOG_CLEANUP";

    private final AuditEventStore auditEventStore;
    private final AuditPipelineService auditPipelineService;
    private final PipelineMetrics metrics;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final AuditPipelineProperties.RetentionProperties retention;

    private final AtomicBoolean sweeping = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> scheduledSweep;

    public RetentionSweeper(AuditEventStore auditEventStore,
                            AuditPipelineService auditPipelineService,
                            PipelineMetrics metrics,
                            @Qualifier("retentionSweepScheduler") TaskScheduler scheduler,
                            Clock clock,
                            AuditPipelineProperties properties) {
        this.auditEventStore = auditEventStore;
        this.auditPipelineService = auditPipelineService;
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.clock = clock;
        this.retention = properties.getRetention();
    }

    /**
     * Scheduled entry point. Skips the run if a sweep is still in progress and
     * never propagates a failure to the scheduler.
     *
     * @return true if a sweep ran
     */
    public boolean tick() {
        if (!sweeping.compareAndSet(false, true)) {
            log.warn("Retention sweep still running, skipping this cycle");
            return false;
        }
        try {
            sweepOnce();
            return true;
        } catch (Exception e) {
            log.error("Retention sweep failed", e);
            return true;
        } finally {
            sweeping.set(false);
        }
    }

    long sweepOnce() {
        Instant now = clock.instant();
        log.info("Starting audit retention sweep - cutoff: {}", now);

        long deleted = auditEventStore.deleteExpired(now);
        metrics.retentionDeleted(deleted);

        if (deleted > 0) {
            auditPipelineService.logInternal(AuditEvent.builder()
                .eventType(CLEANUP_EVENT_TYPE)
                .eventCategory(AuditEventCategory.SYSTEM_OPERATION)
                .severity(AuditSeverity.LOW)
                .description("Deleted " + deleted + " audit records past their retention period")
                .metadata(Map.of("deletedCount", deleted, "sweptAt", now.toString()))
                .build());
        }
        log.info("Audit retention sweep completed - deleted: {}", deleted);
        return deleted;
    }

    @Override
    public synchronized void start() {
        if (!retention.isEnabled()) {
            log.info("Audit retention sweep disabled");
            return;
        }
        if (scheduledSweep != null) {
            return;
        }
        Duration interval = retention.getSweepInterval();
        Instant firstRun = clock.instant().plus(retention.getInitialDelay());
        scheduledSweep = scheduler.scheduleAtFixedRate(this::tick, firstRun, interval);
        log.info("Audit retention sweep scheduled - interval: {}, first run: {}", interval, firstRun);
    }

    @Override
    public synchronized void stop() {
        if (scheduledSweep != null) {
            scheduledSweep.cancel(false);
            scheduledSweep = null;
            log.info("Audit retention sweep stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return scheduledSweep != null;
    }
}
