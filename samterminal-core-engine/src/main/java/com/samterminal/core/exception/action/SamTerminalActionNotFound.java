package com.samterminal.core.exception.action;

import lombok.Data;

@Data
public class SamTerminalActionNotFound extends RuntimeException {
    private final String qualifiedName;

    public SamTerminalActionNotFound(String qualifiedName) {
        super("Action Not Found: " + qualifiedName);
        this.qualifiedName = qualifiedName;
    }
}
