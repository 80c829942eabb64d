package com.waqiti.auditpipeline.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountStatusRequest {
    public static final String BLOCKED = "BLOCKED";

    private String status;
    private String reason;
    private String ruleId;
    private String sourceRequestId;
}
