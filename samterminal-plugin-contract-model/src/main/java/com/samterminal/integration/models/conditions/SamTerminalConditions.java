package com.samterminal.integration.models.conditions;

import com.samterminal.integration.enumerations.SamTerminalConditionOperator;
import com.samterminal.integration.enumerations.SamTerminalLogicalOperator;

import java.util.List;

/**
 * Shorthands for building condition trees in code.
 */
public final class SamTerminalConditions {

    private SamTerminalConditions() {}

    public static SamTerminalSingleCondition condition(String field, SamTerminalConditionOperator operator, Object value) {
        return new SamTerminalSingleCondition(field, operator, value);
    }

    public static SamTerminalConditionGroup and(SamTerminalCondition... conditions) {
        return new SamTerminalConditionGroup(SamTerminalLogicalOperator.AND, List.of(conditions));
    }

    public static SamTerminalConditionGroup or(SamTerminalCondition... conditions) {
        return new SamTerminalConditionGroup(SamTerminalLogicalOperator.OR, List.of(conditions));
    }

    public static SamTerminalSingleCondition eq(String field, Object value) {
        return condition(field, SamTerminalConditionOperator.EQ, value);
    }

    public static SamTerminalSingleCondition gt(String field, Number value) {
        return condition(field, SamTerminalConditionOperator.GT, value);
    }

    public static SamTerminalSingleCondition gte(String field, Number value) {
        return condition(field, SamTerminalConditionOperator.GTE, value);
    }

    public static SamTerminalSingleCondition lt(String field, Number value) {
        return condition(field, SamTerminalConditionOperator.LT, value);
    }

    public static SamTerminalSingleCondition lte(String field, Number value) {
        return condition(field, SamTerminalConditionOperator.LTE, value);
    }

    public static SamTerminalSingleCondition between(String field, Number min, Number max) {
        return condition(field, SamTerminalConditionOperator.BETWEEN, List.of(min, max));
    }

    /**
     * @param percent threshold in percent, negative for a drop
     */
    public static SamTerminalSingleCondition change(String field, Number percent) {
        return condition(field, SamTerminalConditionOperator.CHANGE, percent);
    }
}
