package com.samterminal.core.exception;

public class SamTerminalRuntimeException extends RuntimeException {
    public SamTerminalRuntimeException(String message) {
        super(message);
    }
    public SamTerminalRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
    public SamTerminalRuntimeException(Throwable cause) {
        super(cause);
    }
}
