package com.waqiti.auditpipeline.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waqiti.auditpipeline.domain.ComplianceRuleRecord;
import com.waqiti.auditpipeline.model.AlertChannel;
import com.waqiti.auditpipeline.model.AuditSeverity;
import com.waqiti.auditpipeline.model.AutoResponse;
import com.waqiti.auditpipeline.model.ComplianceRule;
import com.waqiti.auditpipeline.model.RuleCondition;
import com.waqiti.auditpipeline.repository.ComplianceRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads active rules from the {@code compliance_rules} table. A row that
 * cannot be parsed is skipped so that one bad rule does not empty the registry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaComplianceRuleStore implements ComplianceRuleStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<RuleCondition>> CONDITION_LIST = new TypeReference<>() {};
    private static final TypeReference<List<AlertChannel>> CHANNEL_LIST = new TypeReference<>() {};

    private final ComplianceRuleRepository ruleRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public List<ComplianceRule> listActiveRules() {
        List<ComplianceRule> rules = new ArrayList<>();
        for (ComplianceRuleRecord record : ruleRepository.findByActiveTrue()) {
            try {
                rules.add(toRule(record));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Skipping malformed compliance rule - id: {}, reason: {}", record.getId(), e.getMessage());
            }
        }
        return rules;
    }

    ComplianceRule toRule(ComplianceRuleRecord record) throws JsonProcessingException {
        List<String> eventTypes = read(record.getEventTypes(), STRING_LIST);
        List<RuleCondition> conditions = read(record.getConditions(), CONDITION_LIST);
        List<AlertChannel> channels = read(record.getAlertChannels(), CHANNEL_LIST);
        AutoResponse autoResponse = record.getAutoResponse() == null
            ? null
            : objectMapper.readValue(record.getAutoResponse(), AutoResponse.class);

        return ComplianceRule.builder()
            .id(record.getId())
            .name(record.getName())
            .description(record.getDescription())
            .eventTypes(eventTypes)
            .conditions(conditions)
            .severity(record.getSeverity() != null ? record.getSeverity() : AuditSeverity.MEDIUM)
            .alertChannels(channels)
            .autoResponse(autoResponse)
            .active(record.isActive())
            .build();
    }

    private <T> List<T> read(String json, TypeReference<List<T>> type) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        List<T> values = objectMapper.readValue(json, type);
        return values == null ? List.of() : values;
    }
}
