package com.samterminal.core.engine.config;

import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class SamTerminalConditionEvaluatorConfig {
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    /**
     * Age after which a cached observation no longer counts as the previous value of a
     * {@code change} condition.
     */
    @Builder.Default
    Duration cacheTtl = DEFAULT_CACHE_TTL;

    /**
     * When disabled, groups may short-circuit and results carry no details.
     */
    @Builder.Default
    boolean collectDetails = true;

    @Builder.Default
    Clock clock = Clock.systemUTC();

    public static SamTerminalConditionEvaluatorConfig defaults() {
        return SamTerminalConditionEvaluatorConfig.builder().build();
    }
}
