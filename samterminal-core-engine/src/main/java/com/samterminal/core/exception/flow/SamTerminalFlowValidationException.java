package com.samterminal.core.exception.flow;

import lombok.Data;

import java.util.List;

@Data
public class SamTerminalFlowValidationException extends RuntimeException {
    private final String flowId;
    private final List<String> errors;

    public SamTerminalFlowValidationException(String flowId, List<String> errors) {
        super("Invalid flow: [" + flowId + "], Errors: " + errors);
        this.flowId = flowId;
        this.errors = errors;
    }
}
