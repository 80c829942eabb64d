package com.waqiti.auditpipeline.client;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;

/**
 * Account and identity store. Both operations are idempotent for a given
 * {@code Idempotency-Key}: status updates are absolute and risk scores are only raised.
 */
@FeignClient(
    name = "account-service",
    url = "${services.account-service.url:http://account-service:8080}",
    path = "/api/v1/accounts"
)
public interface AccountServiceClient {

    @PutMapping("/users/{userId}/status")
    @CircuitBreaker(name = "accountService")
    void setAccountStatus(@PathVariable("userId") String userId,
                          @RequestHeader("Idempotency-Key") String idempotencyKey,
                          @RequestBody AccountStatusRequest request);

    @PostMapping("/users/{userId}/risk-score/raise")
    @CircuitBreaker(name = "accountService")
    void raiseRiskScore(@PathVariable("userId") String userId,
                        @RequestHeader("Idempotency-Key") String idempotencyKey,
                        @RequestBody RiskScoreRequest request);
}
