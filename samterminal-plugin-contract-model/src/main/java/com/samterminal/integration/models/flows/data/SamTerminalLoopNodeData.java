package com.samterminal.integration.models.flows.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;
import com.samterminal.integration.enumerations.SamTerminalLoopType;
import lombok.Builder;
import lombok.Value;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SamTerminalLoopNodeData implements SamTerminalFlowNodeData {
    SamTerminalLoopType loopType;
    Integer count;
    // variable path of the collection iterated by FOR_EACH
    String items;

    @Builder(toBuilder = true)
    @JsonCreator
    public SamTerminalLoopNodeData(
            @JsonProperty("loopType") SamTerminalLoopType loopType,
            @JsonProperty("count") Integer count,
            @JsonProperty("items") String items) {

        this.loopType = loopType == null ? SamTerminalLoopType.COUNT : loopType;
        this.count = count;
        this.items = items;
    }

    @Override
    public SamTerminalFlowNodeType getNodeType() {
        return SamTerminalFlowNodeType.LOOP;
    }
}
