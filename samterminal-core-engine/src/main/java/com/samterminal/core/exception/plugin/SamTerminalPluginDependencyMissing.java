package com.samterminal.core.exception.plugin;

import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class SamTerminalPluginDependencyMissing extends RuntimeException {
    // plugin name -> dependencies that were never registered
    private final Map<String, List<String>> missingDependencies;

    public SamTerminalPluginDependencyMissing(Map<String, List<String>> missingDependencies) {
        super("Missing plugin dependencies: " + missingDependencies);
        this.missingDependencies = missingDependencies;
    }
}
