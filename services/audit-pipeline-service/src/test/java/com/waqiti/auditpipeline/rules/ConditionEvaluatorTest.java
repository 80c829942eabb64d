package com.waqiti.auditpipeline.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.waqiti.auditpipeline.model.ConditionOperator.CONTAINS;
import static com.waqiti.auditpipeline.model.ConditionOperator.EQUALS;
import static com.waqiti.auditpipeline.model.ConditionOperator.GREATER_THAN;
import static com.waqiti.auditpipeline.model.ConditionOperator.LESS_THAN;
import static com.waqiti.auditpipeline.model.ConditionOperator.REGEX;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ConditionEvaluator")
class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    @Nested
    @DisplayName("equals")
    class Equals {

        @Test
        @DisplayName("Should compare numbers by value across types")
        void shouldCompareNumbersByValue() {
            assertThat(evaluator.evaluate(50000, EQUALS, 50000L)).isTrue();
            assertThat(evaluator.evaluate(new BigDecimal("10.50"), EQUALS, 10.5d)).isTrue();
            assertThat(evaluator.evaluate(10, EQUALS, 11)).isFalse();
        }

        @Test
        @DisplayName("Should compare strings exactly")
        void shouldCompareStrings() {
            assertThat(evaluator.evaluate("CRITICAL", EQUALS, "CRITICAL")).isTrue();
            assertThat(evaluator.evaluate("CRITICAL", EQUALS, "critical")).isFalse();
        }

        @Test
        @DisplayName("Should treat absent value as equal only to null")
        void shouldHandleAbsentValue() {
            assertThat(evaluator.evaluate(null, EQUALS, null)).isTrue();
            assertThat(evaluator.evaluate(null, EQUALS, "x")).isFalse();
        }

        @Test
        @DisplayName("Should compare booleans")
        void shouldCompareBooleans() {
            assertThat(evaluator.evaluate(true, EQUALS, true)).isTrue();
            assertThat(evaluator.evaluate(true, EQUALS, "true")).isFalse();
        }
    }

    @Nested
    @DisplayName("contains")
    class Contains {

        @Test
        @DisplayName("Should match substrings")
        void shouldMatchSubstring() {
            assertThat(evaluator.evaluate("wire transfer abroad", CONTAINS, "transfer")).isTrue();
            assertThat(evaluator.evaluate("deposit", CONTAINS, "transfer")).isFalse();
        }

        @Test
        @DisplayName("Should match collection membership")
        void shouldMatchMembership() {
            assertThat(evaluator.evaluate(List.of("AML", "KYC"), CONTAINS, "KYC")).isTrue();
            assertThat(evaluator.evaluate(List.of("AML"), CONTAINS, "KY")).isFalse();
        }

        @Test
        @DisplayName("Should not match absent value")
        void shouldNotMatchAbsent() {
            assertThat(evaluator.evaluate(null, CONTAINS, "x")).isFalse();
        }
    }

    @Nested
    @DisplayName("numeric comparisons")
    class NumericComparisons {

        @Test
        @DisplayName("Should compare numerically, including numeric strings")
        void shouldCompareNumerically() {
            assertThat(evaluator.evaluate(new BigDecimal("50000.01"), GREATER_THAN, 50000)).isTrue();
            assertThat(evaluator.evaluate(50000, GREATER_THAN, 50000)).isFalse();
            assertThat(evaluator.evaluate("9", LESS_THAN, "10")).isTrue();
            assertThat(evaluator.evaluate(10, LESS_THAN, 10)).isFalse();
        }

        @Test
        @DisplayName("Should be false for absent or non-numeric values")
        void shouldBeFalseForNonNumeric() {
            assertThat(evaluator.evaluate(null, GREATER_THAN, 1)).isFalse();
            assertThat(evaluator.evaluate(null, LESS_THAN, 1)).isFalse();
            assertThat(evaluator.evaluate("abc", GREATER_THAN, 1)).isFalse();
        }
    }

    @Nested
    @DisplayName("regex")
    class Regex {

        @Test
        @DisplayName("Should find the pattern anywhere in the value")
        void shouldFindPattern() {
            assertThat(evaluator.evaluate("BURO_CREDIT_SCORE_REQUEST", REGEX, "^BURO_.*")).isTrue();
            assertThat(evaluator.evaluate("10.0.0.12", REGEX, "^10\\.")).isTrue();
            assertThat(evaluator.evaluate("192.168.1.1", REGEX, "^10\\.")).isFalse();
        }

        @Test
        @DisplayName("Should never match an invalid pattern")
        void shouldNotMatchInvalidPattern() {
            assertThat(evaluator.evaluate("anything", REGEX, "([unclosed")).isFalse();
            assertThat(evaluator.evaluate("anything", REGEX, "([unclosed")).isFalse();
        }
    }

    @Test
    @DisplayName("Should be false without operator")
    void shouldBeFalseWithoutOperator() {
        assertThat(evaluator.evaluate("x", null, "x")).isFalse();
    }
}
