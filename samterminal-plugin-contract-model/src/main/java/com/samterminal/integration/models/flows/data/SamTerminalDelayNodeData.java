package com.samterminal.integration.models.flows.data;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.samterminal.integration.enumerations.SamTerminalDelayType;
import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;
import lombok.Builder;
import lombok.Value;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SamTerminalDelayNodeData implements SamTerminalFlowNodeData {
    long delayMs;
    SamTerminalDelayType delayType;
    // upper bound for RANDOM delays
    Long maxDelayMs;

    @Builder(toBuilder = true)
    public SamTerminalDelayNodeData(long delayMs, SamTerminalDelayType delayType, Long maxDelayMs) {
        this.delayMs = delayMs;
        this.delayType = delayType == null ? SamTerminalDelayType.FIXED : delayType;
        this.maxDelayMs = maxDelayMs;
    }

    @JsonCreator
    static SamTerminalDelayNodeData fromJson(
            @JsonProperty("delayMs") Long delayMs,
            @JsonProperty("delayType") SamTerminalDelayType delayType,
            @JsonProperty("maxDelayMs") Long maxDelayMs) {

        return new SamTerminalDelayNodeData(delayMs == null ? 0L : delayMs, delayType, maxDelayMs);
    }

    @Override
    public SamTerminalFlowNodeType getNodeType() {
        return SamTerminalFlowNodeType.DELAY;
    }
}
