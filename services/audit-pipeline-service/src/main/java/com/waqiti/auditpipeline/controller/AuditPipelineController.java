package com.waqiti.auditpipeline.controller;

import com.waqiti.auditpipeline.api.ApiResponse;
import com.waqiti.auditpipeline.dto.LogAuditEventRequest;
import com.waqiti.auditpipeline.dto.LogAuditEventResponse;
import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.AuditTrailFilter;
import com.waqiti.auditpipeline.model.PipelineMetricsSnapshot;
import com.waqiti.auditpipeline.model.ReportSummary;
import com.waqiti.auditpipeline.service.AuditPipelineService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/audit-pipeline")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Compliance Audit Pipeline", description = "Audit event logging, trail queries and compliance reporting")
@Validated
public class AuditPipelineController {

    private final AuditPipelineService auditPipelineService;

    @PostMapping("/events")
    @Operation(summary = "Log audit event")
    public ResponseEntity<ApiResponse<LogAuditEventResponse>> logEvent(
            @Valid @RequestBody LogAuditEventRequest request) {
        log.debug("Logging audit event: {}", request.getEventType());

        AuditEvent logged = auditPipelineService.logEvent(request.toAuditEvent());
        return ResponseEntity.ok(ApiResponse.success(LogAuditEventResponse.from(logged)));
    }

    @GetMapping("/users/{userId}/trail")
    @Operation(summary = "Get audit trail for user")
    public ResponseEntity<ApiResponse<List<AuditEvent>>> getUserTrail(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(required = false) List<String> eventTypes,
            @RequestParam(required = false) Integer limit) {

        AuditTrailFilter.AuditTrailFilterBuilder filter = AuditTrailFilter.builder()
            .startDate(startDate)
            .endDate(endDate)
            .limit(limit);
        if (eventTypes != null) {
            filter.eventTypes(eventTypes);
        }

        List<AuditEvent> trail = auditPipelineService.queryTrail(userId, filter.build());
        return ResponseEntity.ok(ApiResponse.success(trail));
    }

    @GetMapping("/reports/{reportType}")
    @Operation(summary = "Generate compliance report for a time window")
    public ResponseEntity<ApiResponse<ReportSummary>> getReport(
            @PathVariable String reportType,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate) {

        ReportSummary report = auditPipelineService.report(reportType, startDate, endDate);
        return ResponseEntity.ok(ApiResponse.success(report));
    }

    @PostMapping("/rules/reload")
    @Operation(summary = "Reload compliance rules")
    public ResponseEntity<ApiResponse<Integer>> reloadRules() {
        log.info("Compliance rule reload requested");

        int loaded = auditPipelineService.reloadRules();
        return ResponseEntity.ok(ApiResponse.success(loaded, "Active compliance rules: " + loaded));
    }

    @GetMapping("/metrics")
    @Operation(summary = "Get pipeline metrics")
    public ResponseEntity<ApiResponse<PipelineMetricsSnapshot>> getMetrics() {
        return ResponseEntity.ok(ApiResponse.success(auditPipelineService.metricsSnapshot()));
    }
}
