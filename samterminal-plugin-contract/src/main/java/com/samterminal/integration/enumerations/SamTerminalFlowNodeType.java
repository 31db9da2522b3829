package com.samterminal.integration.enumerations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

@Getter
@AllArgsConstructor
public enum SamTerminalFlowNodeType {
    TRIGGER("trigger"),
    ACTION("action"),
    CONDITION("condition"),
    LOOP("loop"),
    DELAY("delay"),
    OUTPUT("output");

    @JsonValue
    private final String value;

    @JsonCreator
    public static SamTerminalFlowNodeType fromValue(String value) {
        return Arrays.stream(values())
                .filter(v -> v.value.equalsIgnoreCase(value) || v.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown SamTerminalFlowNodeType: [" + value + "]"));
    }
}
