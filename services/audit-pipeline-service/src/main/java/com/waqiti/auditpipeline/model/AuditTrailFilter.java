package com.waqiti.auditpipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
@Builder
public class AuditTrailFilter {
    Instant startDate;
    Instant endDate;

    @Singular
    Set<String> eventTypes;

    Integer limit;

    public static AuditTrailFilter none() {
        return AuditTrailFilter.builder().build();
    }
}
