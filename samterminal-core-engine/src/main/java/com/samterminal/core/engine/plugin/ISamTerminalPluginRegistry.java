package com.samterminal.core.engine.plugin;

import com.samterminal.core.models.SamTerminalPluginRegistrationOptions;
import com.samterminal.core.models.SamTerminalPluginState;
import com.samterminal.integration.contract.ISamTerminalPlugin;

import java.util.List;
import java.util.Map;
import java.util.Set;

public interface ISamTerminalPluginRegistry {

    /**
     * Records the plugin without running any of its code. Dependencies may be registered later.
     */
    void register(ISamTerminalPlugin plugin);

    void register(ISamTerminalPlugin plugin, SamTerminalPluginRegistrationOptions options);

    /**
     * @throws com.samterminal.core.exception.plugin.SamTerminalPluginInUse when registered plugins depend on it
     */
    void unregister(String name);

    ISamTerminalPlugin get(String name);
    boolean has(String name);
    List<ISamTerminalPlugin> getAll();
    Set<String> getNames();
    SamTerminalPluginState getState(String name);
    int size();

    /** Registered plugins declaring a dependency on {@code name}. */
    List<String> getDependents(String name);

    /** Declared dependencies of {@code name} that are not registered. */
    List<String> getMissingDependencies(String name);

    /** Missing dependencies of every registered plugin, empty when all are satisfied. */
    Map<String, List<String>> getMissingDependencies();

    /**
     * Topological order of all registered plugins, dependencies first. Ties are broken by
     * priority (higher first), then by name.
     *
     * @throws com.samterminal.core.exception.plugin.SamTerminalPluginDependencyMissing when a dependency is not registered
     * @throws com.samterminal.core.exception.plugin.SamTerminalPluginCircularDependency when dependencies form a cycle
     */
    List<String> getLoadOrder();
}
