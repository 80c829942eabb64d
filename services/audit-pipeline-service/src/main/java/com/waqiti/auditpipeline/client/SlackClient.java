package com.waqiti.auditpipeline.client;

import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Feign client for the Slack Web API.
 */
@FeignClient(name = "slack", url = "${slack.api.url:https://slack.com/api}")
public interface SlackClient {

    @PostMapping("/chat.postMessage")
    @CircuitBreaker(name = "slackService")
    void postMessage(@RequestBody SlackMessage message);
}
