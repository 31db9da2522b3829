package com.samterminal.integration.models.flows.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;
import com.samterminal.integration.models.util.CopyUtil;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * String params of the form {@code {{path.to.variable}}} are replaced by the variable value
 * before the action is invoked.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SamTerminalActionNodeData implements SamTerminalFlowNodeData {
    String pluginName;
    String actionName;
    Map<String, Object> params;

    @Builder(toBuilder = true)
    @JsonCreator
    public SamTerminalActionNodeData(
            @JsonProperty("pluginName") String pluginName,
            @JsonProperty("actionName") String actionName,
            @JsonProperty("params") Map<String, Object> params) {

        this.pluginName = pluginName;
        this.actionName = actionName;
        this.params = CopyUtil.immutableMap(params);
    }

    @Override
    public SamTerminalFlowNodeType getNodeType() {
        return SamTerminalFlowNodeType.ACTION;
    }
}
