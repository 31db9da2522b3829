package com.samterminal.integration.enumerations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

/**
 * Edge kinds. {@code FAILURE} edges are followed only when their source node fails,
 * {@code CONDITIONAL} edges only when their own condition holds.
 */
@Getter
@AllArgsConstructor
public enum SamTerminalFlowEdgeType {
    DEFAULT("default"),
    SUCCESS("success"),
    CONDITIONAL("conditional"),
    FAILURE("failure");

    @JsonValue
    private final String value;

    @JsonCreator
    public static SamTerminalFlowEdgeType fromValue(String value) {
        return Arrays.stream(values())
                .filter(v -> v.value.equalsIgnoreCase(value) || v.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown SamTerminalFlowEdgeType: [" + value + "]"));
    }
}
