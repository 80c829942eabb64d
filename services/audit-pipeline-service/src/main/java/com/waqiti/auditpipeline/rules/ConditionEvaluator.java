package com.waqiti.auditpipeline.rules;

import com.waqiti.auditpipeline.model.ConditionOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Applies a condition operator to a resolved event value. Pure apart from a
 * cache of compiled patterns; an absent event value never satisfies a condition
 * other than {@code equals null}.
 */
@Component
@Slf4j
public class ConditionEvaluator {

    private final Map<String, Optional<Pattern>> patternCache = new ConcurrentHashMap<>();

    public boolean evaluate(Object eventValue, ConditionOperator operator, Object expected) {
        if (operator == null) {
            return false;
        }
        return switch (operator) {
            case EQUALS -> isEqual(eventValue, expected);
            case CONTAINS -> contains(eventValue, expected);
            case GREATER_THAN -> {
                Integer result = compareNumeric(eventValue, expected);
                yield result != null && result > 0;
            }
            case LESS_THAN -> {
                Integer result = compareNumeric(eventValue, expected);
                yield result != null && result < 0;
            }
            case REGEX -> matches(eventValue, expected);
        };
    }

    private boolean isEqual(Object eventValue, Object expected) {
        if (eventValue == null || expected == null) {
            return eventValue == null && expected == null;
        }
        if (eventValue instanceof Number && expected instanceof Number) {
            Integer result = compareNumeric(eventValue, expected);
            return result != null && result == 0;
        }
        if (eventValue instanceof Boolean || expected instanceof Boolean) {
            return eventValue.equals(expected);
        }
        if (eventValue instanceof CharSequence && expected instanceof CharSequence) {
            return eventValue.toString().equals(expected.toString());
        }
        return eventValue.equals(expected);
    }

    private boolean contains(Object eventValue, Object expected) {
        if (eventValue == null || expected == null) {
            return false;
        }
        if (eventValue instanceof Collection<?> items) {
            String needle = expected.toString();
            return items.stream().anyMatch(item -> item != null && item.toString().equals(needle));
        }
        return eventValue.toString().contains(expected.toString());
    }

    private Integer compareNumeric(Object eventValue, Object expected) {
        BigDecimal left = toDecimal(eventValue);
        BigDecimal right = toDecimal(expected);
        if (left == null || right == null) {
            return null;
        }
        return left.compareTo(right);
    }

    private boolean matches(Object eventValue, Object expected) {
        if (eventValue == null || expected == null) {
            return false;
        }
        return patternCache.computeIfAbsent(expected.toString(), this::compile)
            .map(pattern -> pattern.matcher(eventValue.toString()).find())
            .orElse(false);
    }

    private Optional<Pattern> compile(String regex) {
        try {
            return Optional.of(Pattern.compile(regex));
        } catch (PatternSyntaxException e) {
            log.warn("Invalid regex in compliance rule condition, condition never matches - regex: {}", regex);
            return Optional.empty();
        }
    }

    private static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
