package com.samterminal.integration.models.conditions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.samterminal.integration.enumerations.SamTerminalConditionOperator;
import com.samterminal.integration.models.util.CopyUtil;
import lombok.Value;

/**
 * {@code value} is a scalar, a two element {@code [min, max]} list for
 * {@link SamTerminalConditionOperator#BETWEEN}, or a list of candidates for
 * {@link SamTerminalConditionOperator#IN} and {@link SamTerminalConditionOperator#NOT_IN}.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SamTerminalSingleCondition implements SamTerminalCondition {
    String field;
    SamTerminalConditionOperator operator;
    Object value;

    @JsonCreator
    public SamTerminalSingleCondition(
            @JsonProperty("field") String field,
            @JsonProperty("operator") SamTerminalConditionOperator operator,
            @JsonProperty("value") Object value) {

        this.field = field;
        this.operator = operator;
        this.value = CopyUtil.immutableValue(value);
    }
}
