package com.waqiti.auditpipeline.dispatch;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AlertChannel;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.ComplianceRule;
import com.waqiti.auditpipeline.model.Violation;
import com.waqiti.auditpipeline.service.PipelineMetrics;
import com.waqiti.auditpipeline.service.SecureAuditStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Handles the rules an event matched: alerts on every configured channel,
 * the rule's auto-response and a violation record per match.
 *
 * <p>Rules are handled concurrently on the dispatch executor. Every channel,
 * action and violation write is isolated; a failure is logged and counted and
 * never stops the remaining work or reaches the {@code logEvent} caller.
 *
 * <p>The audit event describing an executed auto-response goes to the follow-up
 * sink as soon as the action succeeds, independent of the triggering event's own
 * write and of the dispatch timeout. Pipeline generated events run on the
 * calling thread so a nested dispatch never waits on the dispatch pool.
 */
@Component
@Slf4j
public class ViolationDispatcher {

    private final Map<AlertChannel, AlertChannelSender> senders = new EnumMap<>(AlertChannel.class);
    private final AutoResponseExecutor autoResponseExecutor;
    private final SecureAuditStorage secureAuditStorage;
    private final PipelineMetrics metrics;
    private final Executor dispatchExecutor;
    private final Clock clock;
    private final Duration timeout;

    public ViolationDispatcher(List<AlertChannelSender> alertChannelSenders,
                               AutoResponseExecutor autoResponseExecutor,
                               SecureAuditStorage secureAuditStorage,
                               PipelineMetrics metrics,
                               @Qualifier("violationDispatchExecutor") Executor dispatchExecutor,
                               Clock clock,
                               AuditPipelineProperties properties) {
        alertChannelSenders.forEach(sender -> senders.put(sender.channel(), sender));
        this.autoResponseExecutor = autoResponseExecutor;
        this.secureAuditStorage = secureAuditStorage;
        this.metrics = metrics;
        this.dispatchExecutor = dispatchExecutor;
        this.clock = clock;
        this.timeout = properties.getDispatch().getTimeout();
    }

    private record RuleResult(boolean autoResponseExecuted, int failedAlerts, boolean autoResponseFailed) {}

    /**
     * @param autoResponsesEnabled false for events the pipeline emitted itself, which never trigger actions
     * @param followUpSink receives the audit event of every executed auto-response, possibly after this returns
     */
    public DispatchOutcome dispatch(AuditEvent event, List<ComplianceRule> matchedRules,
                                    boolean autoResponsesEnabled, Consumer<AuditEvent> followUpSink) {
        if (matchedRules.isEmpty()) {
            return DispatchOutcome.empty();
        }

        Executor executor = autoResponsesEnabled ? dispatchExecutor : Runnable::run;
        List<CompletableFuture<RuleResult>> futures = new ArrayList<>(matchedRules.size());
        for (ComplianceRule rule : matchedRules) {
            futures.add(CompletableFuture.supplyAsync(
                () -> handleRule(event, rule, autoResponsesEnabled, followUpSink), executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Violation dispatch exceeded {} - requestId: {}, continuing with completed rules",
                timeout, event.getRequestId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Violation dispatch interrupted - requestId: {}", event.getRequestId());
        } catch (ExecutionException e) {
            // handleRule isolates its own failures
            log.error("Unexpected violation dispatch failure - requestId: {}", event.getRequestId(), e.getCause());
        }

        int executedAutoResponses = 0;
        int failedAlerts = 0;
        int failedAutoResponses = 0;
        int pending = 0;
        for (CompletableFuture<RuleResult> future : futures) {
            if (!future.isDone()) {
                pending++;
            } else if (!future.isCompletedExceptionally()) {
                RuleResult result = future.join();
                executedAutoResponses += result.autoResponseExecuted() ? 1 : 0;
                failedAlerts += result.failedAlerts();
                failedAutoResponses += result.autoResponseFailed() ? 1 : 0;
            }
        }
        return new DispatchOutcome(executedAutoResponses, failedAlerts, failedAutoResponses, pending);
    }

    private RuleResult handleRule(AuditEvent event, ComplianceRule rule, boolean autoResponsesEnabled,
                                  Consumer<AuditEvent> followUpSink) {
        int failedAlerts = sendAlerts(event, rule);

        Optional<AuditEvent> followUp = Optional.empty();
        boolean autoResponseFailed = false;
        if (rule.getAutoResponse() != null) {
            if (autoResponsesEnabled) {
                try {
                    followUp = autoResponseExecutor.execute(event, rule);
                } catch (Exception e) {
                    autoResponseFailed = true;
                    metrics.autoResponseFailed();
                    log.error("Auto-response failed - action: {}, rule: {}, requestId: {}: {}",
                        rule.getAutoResponse().getAction(), rule.getName(), event.getRequestId(), e.getMessage());
                }
            } else {
                log.debug("Auto-response suppressed for pipeline generated event - rule: {}, type: {}",
                    rule.getName(), event.getEventType());
            }
        }

        followUp.ifPresent(followUpEvent -> emitFollowUp(followUpEvent, followUpSink));

        try {
            secureAuditStorage.storeViolation(Violation.of(event, rule, clock.instant()));
        } catch (Exception e) {
            log.error("Failed to record violation - rule: {}, requestId: {}: {}",
                rule.getName(), event.getRequestId(), e.getMessage());
        }

        return new RuleResult(followUp.isPresent(), failedAlerts, autoResponseFailed);
    }

    private void emitFollowUp(AuditEvent followUpEvent, Consumer<AuditEvent> followUpSink) {
        try {
            followUpSink.accept(followUpEvent);
        } catch (Exception e) {
            metrics.error();
            log.error("Failed to log auto-response audit event - type: {}, userId: {}: {}",
                followUpEvent.getEventType(), followUpEvent.getUserId(), e.getMessage());
        }
    }

    private int sendAlerts(AuditEvent event, ComplianceRule rule) {
        AlertPayload payload = AlertPayload.of(event, rule);
        int failures = 0;
        for (AlertChannel channel : rule.getAlertChannels()) {
            AlertChannelSender sender = senders.get(channel);
            if (sender == null) {
                log.warn("No sender registered for alert channel {} - rule: {}", channel, rule.getName());
                failures++;
                metrics.alertFailed(channel);
                continue;
            }
            try {
                sender.deliver(payload);
            } catch (Exception e) {
                failures++;
                metrics.alertFailed(channel);
                log.warn("Failed to send compliance alert via {} - rule: {}, requestId: {}: {}",
                    channel.getCode(), rule.getName(), event.getRequestId(), e.getMessage());
            }
        }
        return failures;
    }
}
