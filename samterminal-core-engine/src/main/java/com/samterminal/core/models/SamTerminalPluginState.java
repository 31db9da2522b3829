package com.samterminal.core.models;

import com.samterminal.integration.enumerations.SamTerminalPluginStatus;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
public class SamTerminalPluginState {
    private final String name;
    private final String version;
    private final int priority;
    private final Instant loadedAt;
    private final List<String> actionNames;
    private final List<String> providerNames;
    private volatile SamTerminalPluginStatus status;
    private volatile Throwable error;
    private volatile Instant initializedAt;

    public SamTerminalPluginState(String name, String version, int priority, List<String> actionNames, List<String> providerNames) {
        this.name = name;
        this.version = version;
        this.priority = priority;
        this.loadedAt = Instant.now();
        this.actionNames = actionNames;
        this.providerNames = providerNames;
        this.status = SamTerminalPluginStatus.REGISTERED;
    }
}
