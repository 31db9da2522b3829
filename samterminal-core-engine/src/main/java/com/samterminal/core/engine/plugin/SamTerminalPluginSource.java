package com.samterminal.core.engine.plugin;

import com.samterminal.integration.ISamTerminalPluginProvider;
import com.samterminal.integration.contract.ISamTerminalPlugin;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Where a plugin comes from: a ready instance, or a factory invoked with an optional config.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SamTerminalPluginSource {
    private final ISamTerminalPlugin instance;
    private final ISamTerminalPluginProvider provider;
    private final Map<String, Object> config;

    public static SamTerminalPluginSource ofInstance(ISamTerminalPlugin plugin) {
        return new SamTerminalPluginSource(plugin, null, Map.of());
    }

    public static SamTerminalPluginSource ofFactory(ISamTerminalPluginProvider provider) {
        return new SamTerminalPluginSource(null, provider, Map.of());
    }

    public static SamTerminalPluginSource ofFactory(ISamTerminalPluginProvider provider, Map<String, Object> config) {
        return new SamTerminalPluginSource(null, provider, config == null ? Map.of() : config);
    }

    public boolean isFactory() {
        return instance == null;
    }

    @Override
    public String toString() {
        return isFactory()
                ? "factory:" + provider.getClass().getName()
                : "instance:" + instance.getName();
    }
}
