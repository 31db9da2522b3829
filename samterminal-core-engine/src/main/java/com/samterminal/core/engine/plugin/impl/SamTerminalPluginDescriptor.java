package com.samterminal.core.engine.plugin.impl;

import com.samterminal.core.models.SamTerminalPluginState;
import com.samterminal.integration.contract.ISamTerminalPlugin;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

@Getter
class SamTerminalPluginDescriptor {
    private final ISamTerminalPlugin plugin;
    private final List<String> dependencies;
    private final SamTerminalPluginState state;

    SamTerminalPluginDescriptor(ISamTerminalPlugin plugin, int priority) {
        this.plugin = plugin;
        this.dependencies = List.copyOf(Optional.ofNullable(plugin.getDependencies()).orElse(List.of()));
        this.state = new SamTerminalPluginState(
                plugin.getName(),
                plugin.getVersion(),
                priority,
                Optional.ofNullable(plugin.getActions()).orElse(List.of()).stream().map(a -> a.getName()).toList(),
                Optional.ofNullable(plugin.getProviders()).orElse(List.of()).stream().map(p -> p.getName()).toList()
        );
    }

    String getName() {
        return plugin.getName();
    }

    int getPriority() {
        return state.getPriority();
    }
}
