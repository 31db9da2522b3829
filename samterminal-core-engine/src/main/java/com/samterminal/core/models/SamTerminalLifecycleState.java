package com.samterminal.core.models;

public enum SamTerminalLifecycleState {
    IDLE,
    STARTING,
    STARTED,
    FAILED,
    STOPPED
}
