package com.samterminal.core.engine.condition.impl;

import com.samterminal.core.engine.condition.ISamTerminalConditionEvaluator;
import com.samterminal.core.engine.config.SamTerminalConditionEvaluatorConfig;
import com.samterminal.core.models.SamTerminalConditionCacheStats;
import com.samterminal.core.models.SamTerminalConditionDetail;
import com.samterminal.core.models.SamTerminalConditionEvaluationResult;
import com.samterminal.core.util.CastUtil;
import com.samterminal.core.util.PathUtil;
import com.samterminal.integration.enumerations.SamTerminalConditionOperator;
import com.samterminal.integration.enumerations.SamTerminalLogicalOperator;
import com.samterminal.integration.models.conditions.SamTerminalCondition;
import com.samterminal.integration.models.conditions.SamTerminalConditionGroup;
import com.samterminal.integration.models.conditions.SamTerminalSingleCondition;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread safe: the observation cache is a concurrent map, and a {@code change} evaluation swaps
 * in its own observation and reads the previous one in a single atomic step.
 */
@Slf4j
public class SamTerminalConditionEvaluator implements ISamTerminalConditionEvaluator {

    private final SamTerminalConditionEvaluatorConfig config;
    private final Map<String, CacheEntry> previousValues = new ConcurrentHashMap<>();

    public SamTerminalConditionEvaluator() {
        this(SamTerminalConditionEvaluatorConfig.defaults());
    }

    public SamTerminalConditionEvaluator(SamTerminalConditionEvaluatorConfig config) {
        this.config = config;
    }

    @Override
    public SamTerminalConditionEvaluationResult evaluate(SamTerminalCondition condition, Map<String, Object> snapshot) {
        return evaluate(condition, snapshot, null);
    }

    @Override
    public SamTerminalConditionEvaluationResult evaluate(
            SamTerminalCondition condition,
            Map<String, Object> snapshot,
            String tokenKey) {

        List<SamTerminalConditionDetail> details = config.isCollectDetails() ? new ArrayList<>() : null;
        boolean met = evaluateCondition(condition, snapshot == null ? Map.of() : snapshot, tokenKey, details);
        return new SamTerminalConditionEvaluationResult(
                met,
                details == null ? List.of() : Collections.unmodifiableList(details),
                config.getClock().instant());
    }

    // recursive method
    private boolean evaluateCondition(
            SamTerminalCondition condition,
            Map<String, Object> snapshot,
            String tokenKey,
            List<SamTerminalConditionDetail> details) {

        if (condition instanceof SamTerminalConditionGroup group) {
            return evaluateGroup(group, snapshot, tokenKey, details);
        } else if (condition instanceof SamTerminalSingleCondition single) {
            SamTerminalConditionDetail detail = evaluateSingle(single, snapshot, tokenKey);
            if (details != null) {
                details.add(detail);
            }
            return detail.met();
        }
        log.debug("Unsupported condition, treating as not met: [{}]", condition);
        return false;
    }

    private boolean evaluateGroup(
            SamTerminalConditionGroup group,
            Map<String, Object> snapshot,
            String tokenKey,
            List<SamTerminalConditionDetail> details) {

        List<SamTerminalCondition> children = Optional.ofNullable(group.getConditions()).orElse(List.of());
        boolean isOr = group.getOperator() == SamTerminalLogicalOperator.OR;

        // without details nobody observes the skipped children, so stop at the first decisive one
        if (details == null) {
            return isOr
                    ? children.stream().anyMatch(child -> evaluateCondition(child, snapshot, tokenKey, null))
                    : children.stream().allMatch(child -> evaluateCondition(child, snapshot, tokenKey, null));
        }

        boolean met = !isOr;
        for (SamTerminalCondition child : children) {
            boolean childMet = evaluateCondition(child, snapshot, tokenKey, details);
            met = isOr ? (met || childMet) : (met && childMet);
        }
        return met;
    }

    private SamTerminalConditionDetail evaluateSingle(
            SamTerminalSingleCondition condition,
            Map<String, Object> snapshot,
            String tokenKey) {

        Object actual = PathUtil.getValue(snapshot, condition.getField());
        Object expected = condition.getValue();
        boolean met;
        try {
            met = compareValues(condition, actual, expected, tokenKey);
        } catch (RuntimeException e) {
            log.debug("Condition evaluation failed, treating as not met. Condition: [{}], Error: [{}]", condition, e.getMessage());
            met = false;
        }
        return new SamTerminalConditionDetail(condition, met, actual, expected);
    }

    private boolean compareValues(
            SamTerminalSingleCondition condition,
            Object actual,
            Object expected,
            String tokenKey) {

        if (condition.getOperator() == null) {
            return false;
        }
        if (condition.getOperator() == SamTerminalConditionOperator.IS_NULL) {
            return actual == null;
        }
        if (actual == null) {
            return false;
        }

        switch (condition.getOperator()) {
            case EQ:
                return valueEquals(actual, expected);
            case NEQ:
                return !valueEquals(actual, expected);
            case GT:
                return compareNumbers(actual, expected) > 0;
            case GTE:
                return compareNumbers(actual, expected) >= 0;
            case LT:
                return compareNumbers(actual, expected) < 0;
            case LTE:
                return compareNumbers(actual, expected) <= 0;
            case BETWEEN:
                return evaluateBetween(actual, expected);
            case CHANGE:
                return evaluateChange(actual, expected, condition.getField(), tokenKey);
            case CONTAINS:
                return evaluateContains(actual, expected);
            case STARTS_WITH:
                return expected != null && isScalar(actual) && String.valueOf(actual).startsWith(String.valueOf(expected));
            case ENDS_WITH:
                return expected != null && isScalar(actual) && String.valueOf(actual).endsWith(String.valueOf(expected));
            case IN:
                return expected instanceof List<?> candidates && containsValue(candidates, actual);
            case NOT_IN:
                return expected instanceof List<?> candidates && !containsValue(candidates, actual);
            case IS_NOT_NULL:
                return true;
            default:
                return false;
        }
    }

    private boolean valueEquals(Object actual, Object expected) {
        if (actual instanceof Number actualNumber && expected instanceof Number expectedNumber) {
            return actualNumber.doubleValue() == expectedNumber.doubleValue();
        }
        return Objects.equals(actual, expected);
    }

    /**
     * A list field contains an element equal to the value, any other scalar field contains the
     * value's text.
     */
    private boolean evaluateContains(Object actual, Object expected) {
        if (actual instanceof List<?> list) {
            return containsValue(list, expected);
        }
        return expected != null && isScalar(actual) && String.valueOf(actual).contains(String.valueOf(expected));
    }

    private boolean containsValue(List<?> candidates, Object value) {
        return candidates.stream().anyMatch(candidate -> valueEquals(value, candidate));
    }

    private static boolean isScalar(Object value) {
        return !(value instanceof Map<?, ?>) && !(value instanceof List<?>);
    }

    /**
     * NaN is used as "incomparable", every ordering check against it is false.
     */
    private double compareNumbers(Object actual, Object expected) {
        Optional<Double> actualNumber = CastUtil.asNumber(actual);
        Optional<Double> expectedNumber = CastUtil.asNumber(expected);
        if (actualNumber.isEmpty() || expectedNumber.isEmpty()) {
            return Double.NaN;
        }
        return Double.compare(actualNumber.get(), expectedNumber.get());
    }

    private boolean evaluateBetween(Object actual, Object expected) {
        Optional<Double> actualNumber = CastUtil.asNumber(actual);
        if (actualNumber.isEmpty() || !(expected instanceof List<?> range) || range.size() != 2) {
            return false;
        }
        Optional<Double> min = CastUtil.asNumber(range.get(0));
        Optional<Double> max = CastUtil.asNumber(range.get(1));
        if (min.isEmpty() || max.isEmpty()) {
            return false;
        }
        double value = actualNumber.get();
        return value >= min.get() && value <= max.get();
    }

    private boolean evaluateChange(Object actual, Object expected, String field, String tokenKey) {
        Optional<Double> actualNumber = CastUtil.asNumber(actual);
        Optional<Double> threshold = CastUtil.asNumber(expected);
        if (actualNumber.isEmpty() || threshold.isEmpty()) {
            return false;
        }

        Instant now = config.getClock().instant();
        // the current observation always replaces the previous one, met or not
        CacheEntry previous = previousValues.put(cacheKey(tokenKey, field), new CacheEntry(actualNumber.get(), now));

        if (previous == null || isExpired(previous, now) || previous.value() == 0) {
            return false;
        }

        double changePercent = (actualNumber.get() - previous.value()) / previous.value() * 100;
        log.debug("Change of [{}]: [{}%], threshold: [{}%]", cacheKey(tokenKey, field), changePercent, threshold.get());
        if (threshold.get() < 0) {
            return changePercent <= threshold.get();
        }
        return changePercent >= threshold.get();
    }

    private boolean isExpired(CacheEntry entry, Instant now) {
        return Duration.between(entry.timestamp(), now).compareTo(config.getCacheTtl()) > 0;
    }

    private static String cacheKey(String tokenKey, String field) {
        return tokenKey == null ? field : tokenKey + ":" + field;
    }

    @Override
    public void clearCache() {
        previousValues.clear();
    }

    @Override
    public int cleanupCache() {
        Instant now = config.getClock().instant();
        int sizeBefore = previousValues.size();
        previousValues.entrySet().removeIf(entry -> isExpired(entry.getValue(), now));
        int removed = sizeBefore - previousValues.size();
        if (removed > 0) {
            log.debug("Removed expired condition cache entries: [{}]", removed);
        }
        return Math.max(removed, 0);
    }

    @Override
    public void setPreviousValue(String tokenKey, String field, double value) {
        previousValues.put(cacheKey(tokenKey, field), new CacheEntry(value, config.getClock().instant()));
    }

    @Override
    public SamTerminalConditionCacheStats getCacheStats() {
        Instant oldest = previousValues.values().stream()
                .map(CacheEntry::timestamp)
                .min(Instant::compareTo)
                .orElse(null);
        return new SamTerminalConditionCacheStats(previousValues.size(), oldest);
    }

    private record CacheEntry(double value, Instant timestamp) {}
}
