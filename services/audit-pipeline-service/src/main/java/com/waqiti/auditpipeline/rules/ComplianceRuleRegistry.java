package com.waqiti.auditpipeline.rules;

import com.waqiti.auditpipeline.exception.RuleLoadException;
import com.waqiti.auditpipeline.model.ComplianceRule;
import com.waqiti.auditpipeline.store.ComplianceRuleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory registry of active compliance rules.
 *
 * <p>The registry holds an immutable snapshot that is swapped atomically on
 * reload, so readers always see either the old or the new rule set in full.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ComplianceRuleRegistry {

    private final ComplianceRuleStore ruleStore;
    private final Clock clock;

    private final AtomicReference<RuleSnapshot> snapshot = new AtomicReference<>(RuleSnapshot.EMPTY);

    public record RuleSnapshot(List<ComplianceRule> rules, Instant loadedAt) {
        static final RuleSnapshot EMPTY = new RuleSnapshot(List.of(), null);
    }

    public RuleSnapshot current() {
        return snapshot.get();
    }

    public List<ComplianceRule> activeRules() {
        return snapshot.get().rules();
    }

    public int size() {
        return snapshot.get().rules().size();
    }

    /**
     * Replaces the snapshot with the store's current active rules.
     *
     * @throws RuleLoadException if the store is unavailable; the previous snapshot is kept
     */
    public RuleSnapshot reload() {
        List<ComplianceRule> loaded;
        try {
            loaded = ruleStore.listActiveRules();
        } catch (RuntimeException e) {
            log.warn("Failed to load compliance rules, keeping {} cached rules: {}", size(), e.getMessage());
            throw new RuleLoadException("Failed to load compliance rules", e);
        }

        Map<String, ComplianceRule> byId = new LinkedHashMap<>();
        for (ComplianceRule rule : loaded == null ? List.<ComplianceRule>of() : loaded) {
            if (rule != null && rule.isActive()) {
                byId.put(rule.getId() != null ? rule.getId() : rule.getName(), rule);
            }
        }

        RuleSnapshot next = new RuleSnapshot(List.copyOf(byId.values()), clock.instant());
        snapshot.set(next);
        log.info("Loaded {} compliance rules", next.rules().size());
        return next;
    }
}
