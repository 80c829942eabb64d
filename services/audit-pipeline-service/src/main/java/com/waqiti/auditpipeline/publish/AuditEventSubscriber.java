package com.waqiti.auditpipeline.publish;

import com.waqiti.auditpipeline.model.AuditEvent;

/**
 * Downstream consumer of persisted audit events, e.g. a real-time dashboard feed.
 * Receives events in their stored (redacted) form on the publisher's drain thread.
 */
public interface AuditEventSubscriber {

    String name();

    void onEvent(AuditEvent storedEvent);
}
