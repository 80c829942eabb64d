package com.waqiti.auditpipeline.publish;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.service.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Hands persisted events to subscribers through a bounded queue.
 *
 * <p>{@link #publish(AuditEvent)} never blocks: when the queue is full the
 * event is dropped and counted. A single drain thread delivers to each
 * subscriber in turn, isolating subscriber failures.
 */
@Component
@Slf4j
public class AuditEventPublisher implements SmartLifecycle {

    private static final long POLL_TIMEOUT_MS = 500;

    private final BlockingQueue<AuditEvent> queue;
    private final List<AuditEventSubscriber> subscribers;
    private final PipelineMetrics metrics;

    private volatile boolean running;
    private ExecutorService drainExecutor;

    public AuditEventPublisher(List<AuditEventSubscriber> subscribers,
                               PipelineMetrics metrics,
                               AuditPipelineProperties properties) {
        this.subscribers = List.copyOf(subscribers);
        this.metrics = metrics;
        this.queue = new ArrayBlockingQueue<>(properties.getPublishing().getQueueCapacity());
    }

    public boolean publish(AuditEvent storedEvent) {
        if (subscribers.isEmpty()) {
            return true;
        }
        boolean accepted = queue.offer(storedEvent);
        if (!accepted) {
            metrics.publishDropped();
            log.warn("Subscriber queue full, audit event not published - requestId: {}", storedEvent.getRequestId());
        }
        return accepted;
    }

    int pending() {
        return queue.size();
    }

    /**
     * Delivers everything currently queued. Returns the number of events delivered.
     */
    int drain() {
        int delivered = 0;
        AuditEvent event;
        while ((event = queue.poll()) != null) {
            deliver(event);
            delivered++;
        }
        return delivered;
    }

    private void deliver(AuditEvent event) {
        for (AuditEventSubscriber subscriber : subscribers) {
            try {
                subscriber.onEvent(event);
            } catch (Exception e) {
                log.warn("Audit subscriber {} failed - requestId: {}: {}",
                    subscriber.name(), event.getRequestId(), e.getMessage());
            }
        }
    }

    private void drainLoop() {
        while (running) {
            try {
                AuditEvent event = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (event != null) {
                    deliver(event);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
        drain();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        drainExecutor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "audit-event-publisher");
            thread.setDaemon(true);
            return thread;
        });
        drainExecutor.submit(this::drainLoop);
        log.info("Audit event publisher started - subscribers: {}", subscribers.size());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        drainExecutor.shutdown();
        try {
            if (!drainExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                drainExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            drainExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Audit event publisher stopped - undelivered: {}", queue.size());
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
