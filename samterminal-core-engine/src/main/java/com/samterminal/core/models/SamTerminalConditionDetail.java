package com.samterminal.core.models;

import com.samterminal.integration.models.conditions.SamTerminalSingleCondition;

public record SamTerminalConditionDetail(
        SamTerminalSingleCondition condition,
        boolean met,
        Object actualValue,
        Object expectedValue) {
}
