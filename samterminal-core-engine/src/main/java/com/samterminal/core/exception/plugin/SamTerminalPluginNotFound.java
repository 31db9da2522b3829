package com.samterminal.core.exception.plugin;

import lombok.Data;

@Data
public class SamTerminalPluginNotFound extends RuntimeException {
    private final String pluginName;

    public SamTerminalPluginNotFound(String pluginName) {
        super("Plugin Not Found: " + pluginName);
        this.pluginName = pluginName;
    }
}
