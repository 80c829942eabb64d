package com.waqiti.auditpipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class PipelineMetricsSnapshot {
    long eventsLogged;
    long complianceViolations;
    long criticalEvents;
    double averageLogTimeMs;
    long errors;
    long publishDropped;
    int rulesLoaded;
    String serverId;
    String environment;
    Duration uptime;
}
