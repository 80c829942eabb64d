package com.waqiti.auditpipeline.service;

import com.waqiti.auditpipeline.config.AuditPipelineProperties;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditEventCategory;
import com.waqiti.auditpipeline.model.AuditSeverity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditPipelineInitializer {

    private final AuditPipelineService auditPipelineService;
    private final AuditPipelineProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int rules = auditPipelineService.reloadRules();

        auditPipelineService.logInternal(AuditEvent.builder()
            .eventType("AUDIT_PIPELINE_INITIALIZED")
            .eventCategory(AuditEventCategory.SYSTEM_OPERATION)
            .severity(AuditSeverity.LOW)
            .description("Compliance audit pipeline initialized")
            .metadata(Map.of(
                "serverId", properties.getServerId(),
                "environment", properties.getEnvironment(),
                "rulesLoaded", rules))
            .build());

        log.info("Compliance audit pipeline ready - serverId: {}, environment: {}, rules: {}",
            properties.getServerId(), properties.getEnvironment(), rules);
    }
}
