package com.waqiti.auditpipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

@SpringBootApplication
@EnableFeignClients
public class AuditPipelineServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AuditPipelineServiceApplication.class, args);
    }
}
