package com.samterminal.core.engine.condition;

import com.samterminal.core.models.SamTerminalConditionCacheStats;
import com.samterminal.core.models.SamTerminalConditionEvaluationResult;
import com.samterminal.integration.models.conditions.SamTerminalCondition;

import java.util.Map;

/**
 * Evaluates condition trees against a data snapshot. Evaluation never throws: absent or
 * malformed data makes a condition not met.
 */
public interface ISamTerminalConditionEvaluator {

    SamTerminalConditionEvaluationResult evaluate(SamTerminalCondition condition, Map<String, Object> snapshot);

    /**
     * @param tokenKey scopes the observations kept for {@code change} conditions, may be {@code null}
     */
    SamTerminalConditionEvaluationResult evaluate(SamTerminalCondition condition, Map<String, Object> snapshot, String tokenKey);

    void clearCache();

    /**
     * Drops cached observations older than the configured TTL.
     *
     * @return number of removed entries
     */
    int cleanupCache();

    /**
     * Seeds the previous observation of a field, so the next {@code change} evaluation has
     * something to compare against.
     */
    void setPreviousValue(String tokenKey, String field, double value);

    SamTerminalConditionCacheStats getCacheStats();
}
