package com.waqiti.auditpipeline.store;

import com.waqiti.auditpipeline.model.ComplianceRule;

import java.util.List;

/**
 * Source of compliance rules. Every call returns a full replacement snapshot
 * of the active rules, never a delta.
 */
public interface ComplianceRuleStore {

    List<ComplianceRule> listActiveRules();
}
