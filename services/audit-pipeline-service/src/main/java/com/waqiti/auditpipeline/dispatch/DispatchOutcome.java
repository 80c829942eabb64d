package com.waqiti.auditpipeline.dispatch;

/**
 * Result of dispatching one event's violations.
 *
 * @param pendingRules rules still running when the dispatch timeout expired; their outcome is not counted here
 */
public record DispatchOutcome(int executedAutoResponses, int failedAlerts, int failedAutoResponses, int pendingRules) {

    public static DispatchOutcome empty() {
        return new DispatchOutcome(0, 0, 0, 0);
    }
}
