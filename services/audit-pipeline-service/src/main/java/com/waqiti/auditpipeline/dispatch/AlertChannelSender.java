package com.waqiti.auditpipeline.dispatch;

import com.waqiti.auditpipeline.model.AlertChannel;

/**
 * One alert delivery channel. Success is returning normally; any exception is a failed delivery.
 */
public interface AlertChannelSender {

    AlertChannel channel();

    void deliver(AlertPayload payload);
}
