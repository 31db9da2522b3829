package com.samterminal.core.exception.flow;

import lombok.Data;

@Data
public class SamTerminalFlowNotFound extends RuntimeException {
    private final String flowId;

    public SamTerminalFlowNotFound(String flowId) {
        super("Flow Not Found: " + flowId);
        this.flowId = flowId;
    }
}
