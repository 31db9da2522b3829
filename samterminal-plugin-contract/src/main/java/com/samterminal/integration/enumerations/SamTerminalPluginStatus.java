package com.samterminal.integration.enumerations;

public enum SamTerminalPluginStatus {
    REGISTERED,
    INITIALIZING,
    ACTIVE,
    ERROR,
    DESTROYED
}
