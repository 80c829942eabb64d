package com.waqiti.auditpipeline.rules;

import com.waqiti.auditpipeline.exception.RuleLoadException;
import com.waqiti.auditpipeline.model.ComplianceRule;
import com.waqiti.auditpipeline.store.ComplianceRuleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ComplianceRuleRegistry")
class ComplianceRuleRegistryTest {

    private static final Instant NOW = Instant.parse("2026-01-10T00:00:00Z");

    @Mock
    private ComplianceRuleStore ruleStore;

    private ComplianceRuleRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ComplianceRuleRegistry(ruleStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static ComplianceRule rule(String id, String name, boolean active) {
        return ComplianceRule.builder().id(id).name(name).eventType("ANY").active(active).build();
    }

    @Test
    @DisplayName("Should start empty")
    void shouldStartEmpty() {
        assertThat(registry.activeRules()).isEmpty();
        assertThat(registry.current().loadedAt()).isNull();
    }

    @Test
    @DisplayName("Should load active rules and drop inactive and duplicate ones")
    void shouldLoadActiveRules() {
        // Given
        when(ruleStore.listActiveRules()).thenReturn(List.of(
            rule("r1", "FIRST", true),
            rule("r2", "DISABLED", false),
            rule("r1", "FIRST_DUPLICATE", true),
            rule("r3", "THIRD", true)));

        // When
        ComplianceRuleRegistry.RuleSnapshot snapshot = registry.reload();

        // Then
        assertThat(snapshot.rules()).extracting(ComplianceRule::getId).containsExactly("r1", "r3");
        assertThat(snapshot.loadedAt()).isEqualTo(NOW);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep previous snapshot when the store fails")
    void shouldKeepPreviousSnapshotOnFailure() {
        // Given
        when(ruleStore.listActiveRules())
            .thenReturn(List.of(rule("r1", "FIRST", true)))
            .thenThrow(new DataAccessResourceFailureException("db down"));
        registry.reload();

        // When / Then
        assertThatThrownBy(() -> registry.reload()).isInstanceOf(RuleLoadException.class);
        assertThat(registry.activeRules()).extracting(ComplianceRule::getName).containsExactly("FIRST");
    }

    @Test
    @DisplayName("Should expose an immutable rule list")
    void shouldExposeImmutableRules() {
        when(ruleStore.listActiveRules()).thenReturn(List.of(rule("r1", "FIRST", true)));
        registry.reload();

        assertThatThrownBy(() -> registry.activeRules().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
