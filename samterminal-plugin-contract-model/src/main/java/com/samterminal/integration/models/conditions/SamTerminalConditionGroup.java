package com.samterminal.integration.models.conditions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.samterminal.integration.enumerations.SamTerminalLogicalOperator;
import com.samterminal.integration.models.util.CopyUtil;
import lombok.Value;

import java.util.List;

/**
 * Operator defaults to {@code AND}.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SamTerminalConditionGroup implements SamTerminalCondition {
    SamTerminalLogicalOperator operator;
    List<SamTerminalCondition> conditions;

    @JsonCreator
    public SamTerminalConditionGroup(
            @JsonProperty("operator") SamTerminalLogicalOperator operator,
            @JsonProperty("conditions") List<SamTerminalCondition> conditions) {

        this.operator = operator == null ? SamTerminalLogicalOperator.AND : operator;
        this.conditions = CopyUtil.immutableList(conditions);
    }
}
