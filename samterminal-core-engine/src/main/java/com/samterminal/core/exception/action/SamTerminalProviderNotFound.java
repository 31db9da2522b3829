package com.samterminal.core.exception.action;

import lombok.Data;

@Data
public class SamTerminalProviderNotFound extends RuntimeException {
    private final String qualifiedName;

    public SamTerminalProviderNotFound(String qualifiedName) {
        super("Provider Not Found: " + qualifiedName);
        this.qualifiedName = qualifiedName;
    }
}
