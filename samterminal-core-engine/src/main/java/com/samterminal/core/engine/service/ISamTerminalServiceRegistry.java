package com.samterminal.core.engine.service;

import com.samterminal.core.models.SamTerminalServiceRegistryStats;
import com.samterminal.integration.contract.action.ISamTerminalAction;
import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;

import java.util.Optional;
import java.util.Set;

/**
 * Actions and providers contributed by plugins, keyed {@code pluginName:name}.
 * Safe for concurrent lookups while flows execute.
 */
public interface ISamTerminalServiceRegistry {
    void registerAction(String pluginName, ISamTerminalAction action);
    void registerProvider(String pluginName, ISamTerminalDataProvider provider);

    Optional<ISamTerminalAction> findAction(String qualifiedName);
    ISamTerminalAction getAction(String pluginName, String actionName);
    Optional<ISamTerminalDataProvider> findProvider(String qualifiedName);
    ISamTerminalDataProvider getProvider(String pluginName, String providerName);

    Set<String> getActionNames();
    Set<String> getProviderNames();

    /**
     * Removes every action and provider owned by the plugin.
     *
     * @return number of removed entries
     */
    int unregisterPlugin(String pluginName);

    SamTerminalServiceRegistryStats getStats();
}
