package com.waqiti.auditpipeline.service;

import com.waqiti.auditpipeline.model.AlertChannel;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditSeverity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running pipeline counters. Micrometer meters are exported through Actuator;
 * the atomic mirrors back {@link com.waqiti.auditpipeline.model.PipelineMetricsSnapshot}.
 * The average log time is approximate.
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Instant startedAt;

    private final AtomicLong eventsLogged = new AtomicLong();
    private final AtomicLong complianceViolations = new AtomicLong();
    private final AtomicLong criticalEvents = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong publishDropped = new AtomicLong();
    private final AtomicLong totalLogTimeNanos = new AtomicLong();

    private final Counter violationCounter;
    private final Counter criticalCounter;
    private final Counter errorCounter;
    private final Counter autoResponseFailureCounter;
    private final Counter publishDroppedCounter;
    private final Counter retentionDeletedCounter;
    private final Timer logTimer;

    public PipelineMetrics(MeterRegistry meterRegistry, Clock clock) {
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.violationCounter = meterRegistry.counter("audit.pipeline.violations");
        this.criticalCounter = meterRegistry.counter("audit.pipeline.events.critical");
        this.errorCounter = meterRegistry.counter("audit.pipeline.errors");
        this.autoResponseFailureCounter = meterRegistry.counter("audit.pipeline.auto-responses.failed");
        this.publishDroppedCounter = meterRegistry.counter("audit.pipeline.publish.dropped");
        this.retentionDeletedCounter = meterRegistry.counter("audit.pipeline.retention.deleted");
        this.logTimer = meterRegistry.timer("audit.pipeline.log.duration");
    }

    public void eventLogged(AuditEvent event, long elapsedNanos) {
        eventsLogged.incrementAndGet();
        totalLogTimeNanos.addAndGet(elapsedNanos);
        meterRegistry.counter("audit.pipeline.events.logged", "category", event.getEventCategory().getCode())
            .increment();
        logTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
        if (event.getSeverity() == AuditSeverity.CRITICAL) {
            criticalEvents.incrementAndGet();
            criticalCounter.increment();
        }
    }

    public void violationsDetected(int count) {
        complianceViolations.addAndGet(count);
        violationCounter.increment(count);
    }

    public void error() {
        errors.incrementAndGet();
        errorCounter.increment();
    }

    public void alertFailed(AlertChannel channel) {
        meterRegistry.counter("audit.pipeline.alerts.failed", "channel", channel.getCode()).increment();
    }

    public void autoResponseFailed() {
        autoResponseFailureCounter.increment();
    }

    public void publishDropped() {
        publishDropped.incrementAndGet();
        publishDroppedCounter.increment();
    }

    public void retentionDeleted(long count) {
        retentionDeletedCounter.increment(count);
    }

    public long getEventsLogged() {
        return eventsLogged.get();
    }

    public long getComplianceViolations() {
        return complianceViolations.get();
    }

    public long getCriticalEvents() {
        return criticalEvents.get();
    }

    public long getErrors() {
        return errors.get();
    }

    public long getPublishDropped() {
        return publishDropped.get();
    }

    public double getAverageLogTimeMs() {
        long count = eventsLogged.get();
        return count == 0 ? 0d : totalLogTimeNanos.get() / (double) count / 1_000_000d;
    }

    public Duration getUptime() {
        return Duration.between(startedAt, clock.instant());
    }
}
