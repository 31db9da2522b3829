package com.samterminal.core.exception.plugin;

import lombok.Data;

import java.util.List;

@Data
public class SamTerminalInvalidPlugin extends RuntimeException {
    private final String pluginName;
    private final List<String> problems;

    public SamTerminalInvalidPlugin(String pluginName, List<String> problems) {
        super("Invalid plugin: [" + pluginName + "], Problems: " + problems);
        this.pluginName = pluginName;
        this.problems = problems;
    }
}
