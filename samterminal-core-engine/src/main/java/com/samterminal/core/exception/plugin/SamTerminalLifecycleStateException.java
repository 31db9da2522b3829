package com.samterminal.core.exception.plugin;

import com.samterminal.core.models.SamTerminalLifecycleState;
import lombok.Data;

@Data
public class SamTerminalLifecycleStateException extends RuntimeException {
    private final SamTerminalLifecycleState currentState;
    private final String operation;

    public SamTerminalLifecycleStateException(SamTerminalLifecycleState currentState, String operation) {
        super("Cannot " + operation + " plugins, lifecycle is " + currentState);
        this.currentState = currentState;
        this.operation = operation;
    }
}
