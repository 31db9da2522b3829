package com.samterminal.integration.models.flows;

import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;
import com.samterminal.integration.models.flows.data.SamTerminalFlowNodeData;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SamTerminalFlowNode {
    String id;
    SamTerminalFlowNodeType type;
    String name;
    String description;
    SamTerminalFlowNodeData data;

    public static SamTerminalFlowNode of(String id, String name, SamTerminalFlowNodeData data) {
        return new SamTerminalFlowNode(id, data.getNodeType(), name, null, data);
    }

    /**
     * @return the node name, falling back to the id
     */
    public String displayName() {
        return name != null ? name : id;
    }
}
