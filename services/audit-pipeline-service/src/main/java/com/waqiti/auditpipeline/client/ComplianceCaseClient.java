package com.waqiti.auditpipeline.client;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Compliance notification and ticketing system. Calls are opaque to the pipeline.
 */
@FeignClient(
    name = "compliance-service",
    url = "${services.compliance-service.url:http://compliance-service:8080}",
    path = "/api/v1/compliance"
)
public interface ComplianceCaseClient {

    @PostMapping("/notifications")
    @CircuitBreaker(name = "complianceService")
    void notifyCompliance(@RequestBody ComplianceCaseRequest request);

    @PostMapping("/tickets")
    @CircuitBreaker(name = "complianceService")
    void createTicket(@RequestBody ComplianceCaseRequest request);
}
