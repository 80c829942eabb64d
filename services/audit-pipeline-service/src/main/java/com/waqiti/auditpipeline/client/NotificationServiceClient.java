package com.waqiti.auditpipeline.client;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the platform notification service, used for e-mail and SMS alerts.
 */
@FeignClient(
    name = "notification-service",
    url = "${services.notification-service.url:http://notification-service:8080}",
    path = "/api/v1/notifications"
)
public interface NotificationServiceClient {

    @PostMapping("/send")
    @CircuitBreaker(name = "notificationService")
    void sendNotification(@RequestBody NotificationRequest request);
}
