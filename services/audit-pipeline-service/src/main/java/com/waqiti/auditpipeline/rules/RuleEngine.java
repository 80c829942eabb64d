package com.waqiti.auditpipeline.rules;

import com.waqiti.auditpipeline.model.AuditEvent;
import com.waqiti.auditpipeline.model.ComplianceRule;
import com.waqiti.auditpipeline.model.RuleCondition;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates an enriched event against the registry's current snapshot.
 * Deterministic and side-effect free for a given snapshot.
 */
@Component
@RequiredArgsConstructor
public class RuleEngine {

    private final ComplianceRuleRegistry registry;
    private final EventFieldResolver fieldResolver;
    private final ConditionEvaluator conditionEvaluator;

    public List<ComplianceRule> evaluate(AuditEvent event) {
        return evaluate(event, registry.activeRules());
    }

    public List<ComplianceRule> evaluate(AuditEvent event, List<ComplianceRule> rules) {
        List<ComplianceRule> matches = new ArrayList<>();
        for (ComplianceRule rule : rules) {
            if (rule.appliesTo(event.getEventType()) && conditionsHold(event, rule)) {
                matches.add(rule);
            }
        }
        return matches;
    }

    private boolean conditionsHold(AuditEvent event, ComplianceRule rule) {
        for (RuleCondition condition : rule.getConditions()) {
            Object actual = fieldResolver.resolve(event, condition.getField());
            if (!conditionEvaluator.evaluate(actual, condition.getOperator(), condition.getValue())) {
                return false;
            }
        }
        return true;
    }
}
