package com.samterminal.core.exception.plugin;

import lombok.Data;

import java.util.List;

@Data
public class SamTerminalPluginInUse extends RuntimeException {
    private final String pluginName;
    private final List<String> dependents;

    public SamTerminalPluginInUse(String pluginName, List<String> dependents) {
        super("Plugin [" + pluginName + "] is required by " + dependents);
        this.pluginName = pluginName;
        this.dependents = dependents;
    }
}
