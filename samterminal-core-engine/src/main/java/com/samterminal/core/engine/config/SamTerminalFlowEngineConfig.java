package com.samterminal.core.engine.config;

import lombok.Builder;
import lombok.Value;

import java.util.Random;

@Value
@Builder(toBuilder = true)
public class SamTerminalFlowEngineConfig {

    @Builder.Default
    boolean validateBeforeExecute = true;

    // guards flows whose edges form a cycle
    @Builder.Default
    int maxNodeVisits = 10_000;

    @Builder.Default
    int maxLoopIterations = 1_000;

    // oldest executions are forgotten beyond this
    @Builder.Default
    int maxRetainedExecutions = 1_000;

    // source of RANDOM delays
    @Builder.Default
    Random random = new Random();

    public static SamTerminalFlowEngineConfig defaults() {
        return SamTerminalFlowEngineConfig.builder().build();
    }
}
