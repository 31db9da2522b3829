package com.samterminal.integration.enumerations;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;

@Getter
@AllArgsConstructor
public enum SamTerminalConditionOperator {
    EQ("eq"),
    NEQ("neq"),
    GT("gt"),
    GTE("gte"),
    LT("lt"),
    LTE("lte"),

    /**
     * Inclusive range check, the condition value is a {@code [min, max]} pair.
     */
    BETWEEN("between"),

    /**
     * Percent change of the field against the previously observed value. A negative
     * threshold asks for a drop of at least that size, a positive one for a rise.
     */
    CHANGE("change"),

    /**
     * Element membership when the field is a list, substring match otherwise.
     */
    CONTAINS("contains"),
    STARTS_WITH("startsWith"),
    ENDS_WITH("endsWith"),

    /**
     * The condition value is the list of candidates.
     */
    IN("in"),
    NOT_IN("notIn"),

    /**
     * The only operator met when the field is absent.
     */
    IS_NULL("isNull"),
    IS_NOT_NULL("isNotNull");

    @JsonValue
    private final String value;

    @JsonCreator
    public static SamTerminalConditionOperator fromValue(String value) {
        return Arrays.stream(values())
                .filter(v -> v.value.equalsIgnoreCase(value) || v.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown SamTerminalConditionOperator: [" + value + "]"));
    }
}
