package com.samterminal.integration.models.flows.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;
import com.samterminal.integration.models.util.CopyUtil;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SamTerminalTriggerNodeData implements SamTerminalFlowNodeData {
    String triggerType;
    Map<String, Object> config;

    @Builder(toBuilder = true)
    @JsonCreator
    public SamTerminalTriggerNodeData(
            @JsonProperty("triggerType") String triggerType,
            @JsonProperty("config") Map<String, Object> config) {

        this.triggerType = triggerType == null ? "manual" : triggerType;
        this.config = CopyUtil.immutableMap(config);
    }

    @Override
    public SamTerminalFlowNodeType getNodeType() {
        return SamTerminalFlowNodeType.TRIGGER;
    }
}
