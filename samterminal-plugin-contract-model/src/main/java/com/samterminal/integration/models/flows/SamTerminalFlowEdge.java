package com.samterminal.integration.models.flows;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.samterminal.integration.constant.SamTerminalConstants;
import com.samterminal.integration.enumerations.SamTerminalFlowEdgeType;
import com.samterminal.integration.models.conditions.SamTerminalSingleCondition;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SamTerminalFlowEdge {
    String id;
    String source;
    String target;
    String sourceHandle;
    String targetHandle;
    @Builder.Default
    SamTerminalFlowEdgeType type = SamTerminalFlowEdgeType.DEFAULT;
    String label;
    // only evaluated for CONDITIONAL edges
    SamTerminalSingleCondition condition;

    @JsonIgnore
    public boolean isFailureEdge() {
        return SamTerminalConstants.ERROR_HANDLE.equals(sourceHandle) || type == SamTerminalFlowEdgeType.FAILURE;
    }

    public static SamTerminalFlowEdge of(String source, String target) {
        return SamTerminalFlowEdge.builder()
                .id(source + "->" + target)
                .source(source)
                .target(target)
                .build();
    }

    public static SamTerminalFlowEdge ofTrue(String source, String target) {
        return SamTerminalFlowEdge.builder()
                .id(source + "-true->" + target)
                .source(source)
                .target(target)
                .sourceHandle(SamTerminalConstants.TRUE_HANDLE)
                .label("Yes")
                .build();
    }

    public static SamTerminalFlowEdge ofFalse(String source, String target) {
        return SamTerminalFlowEdge.builder()
                .id(source + "-false->" + target)
                .source(source)
                .target(target)
                .sourceHandle(SamTerminalConstants.FALSE_HANDLE)
                .label("No")
                .build();
    }

    public static SamTerminalFlowEdge ofFailure(String source, String target) {
        return SamTerminalFlowEdge.builder()
                .id(source + "-error->" + target)
                .source(source)
                .target(target)
                .sourceHandle(SamTerminalConstants.ERROR_HANDLE)
                .type(SamTerminalFlowEdgeType.FAILURE)
                .label("Error")
                .build();
    }

    public static SamTerminalFlowEdge ofCondition(String source, String target, SamTerminalSingleCondition condition) {
        return SamTerminalFlowEdge.builder()
                .id(source + "-if->" + target)
                .source(source)
                .target(target)
                .type(SamTerminalFlowEdgeType.CONDITIONAL)
                .condition(condition)
                .build();
    }
}
