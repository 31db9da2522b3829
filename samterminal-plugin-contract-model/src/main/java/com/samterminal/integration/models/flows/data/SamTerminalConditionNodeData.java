package com.samterminal.integration.models.flows.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;
import com.samterminal.integration.enumerations.SamTerminalLogicalOperator;
import com.samterminal.integration.models.conditions.SamTerminalCondition;
import com.samterminal.integration.models.conditions.SamTerminalConditionGroup;
import com.samterminal.integration.models.util.CopyUtil;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Flattened conditions joined by {@code operator}. When a generator kept the nested tree it
 * compiled them from, {@code _originalConditionGroup} carries it and takes precedence.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SamTerminalConditionNodeData implements SamTerminalFlowNodeData {
    List<SamTerminalCondition> conditions;
    SamTerminalLogicalOperator operator;
    @JsonProperty("_originalConditionGroup")
    SamTerminalConditionGroup originalConditionGroup;
    String tokenKey;

    @Builder(toBuilder = true)
    @JsonCreator
    public SamTerminalConditionNodeData(
            @JsonProperty("conditions") List<SamTerminalCondition> conditions,
            @JsonProperty("operator") SamTerminalLogicalOperator operator,
            @JsonProperty("_originalConditionGroup") SamTerminalConditionGroup originalConditionGroup,
            @JsonProperty("tokenKey") String tokenKey) {

        this.conditions = CopyUtil.immutableList(conditions);
        this.operator = operator == null ? SamTerminalLogicalOperator.AND : operator;
        this.originalConditionGroup = originalConditionGroup;
        this.tokenKey = tokenKey;
    }

    @Override
    public SamTerminalFlowNodeType getNodeType() {
        return SamTerminalFlowNodeType.CONDITION;
    }
}
