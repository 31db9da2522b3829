package com.samterminal.core.exception.plugin;

import lombok.Data;

import java.util.List;

@Data
public class SamTerminalPluginCircularDependency extends RuntimeException {
    private final List<String> cycle;

    public SamTerminalPluginCircularDependency(List<String> cycle) {
        super("Circular plugin dependency: " + String.join(" -> ", cycle));
        this.cycle = cycle;
    }
}
