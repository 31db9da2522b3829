package com.samterminal.core.models;

import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class SamTerminalConditionEvaluationResult {
    private final boolean met;
    // one entry per evaluated leaf, empty when detail collection is disabled
    private final List<SamTerminalConditionDetail> details;
    private final Instant evaluatedAt;
}
