package com.samterminal.integration.enumerations;

public enum SamTerminalLifecycleEvent {
    BEFORE_INIT,
    AFTER_INIT,
    BEFORE_DESTROY,
    AFTER_DESTROY,
    ERROR
}
