package com.waqiti.auditpipeline.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raises the account's risk score to at least {@code minimumScore}; never lowers it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskScoreRequest {
    private int minimumScore;
    private String reason;
    private String ruleId;
    private String sourceRequestId;
}
