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
public class SamTerminalOutputNodeData implements SamTerminalFlowNodeData {
    String outputType;
    Map<String, Object> config;

    @Builder(toBuilder = true)
    @JsonCreator
    public SamTerminalOutputNodeData(
            @JsonProperty("outputType") String outputType,
            @JsonProperty("config") Map<String, Object> config) {

        this.outputType = outputType == null ? "result" : outputType;
        this.config = CopyUtil.immutableMap(config);
    }

    @Override
    public SamTerminalFlowNodeType getNodeType() {
        return SamTerminalFlowNodeType.OUTPUT;
    }
}
