package com.samterminal.core.exception.flow;

import com.samterminal.core.exception.SamTerminalRuntimeException;

public class SamTerminalFlowImportFailed extends SamTerminalRuntimeException {
    public SamTerminalFlowImportFailed(String message) {
        super(message);
    }

    public SamTerminalFlowImportFailed(String message, Throwable cause) {
        super(message, cause);
    }
}
