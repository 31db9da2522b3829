package com.samterminal.integration.models.flows.data;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;

/**
 * Type specific payload of a flow node. Each {@link SamTerminalFlowNodeType} has exactly one
 * data class.
 */
public interface SamTerminalFlowNodeData {

    @JsonIgnore
    SamTerminalFlowNodeType getNodeType();

    static Class<? extends SamTerminalFlowNodeData> dataTypeOf(SamTerminalFlowNodeType nodeType) {
        switch (nodeType) {
            case TRIGGER:
                return SamTerminalTriggerNodeData.class;
            case ACTION:
                return SamTerminalActionNodeData.class;
            case CONDITION:
                return SamTerminalConditionNodeData.class;
            case LOOP:
                return SamTerminalLoopNodeData.class;
            case DELAY:
                return SamTerminalDelayNodeData.class;
            case OUTPUT:
                return SamTerminalOutputNodeData.class;
            default:
                throw new IllegalArgumentException("Unsupported node type: [" + nodeType + "]");
        }
    }
}
