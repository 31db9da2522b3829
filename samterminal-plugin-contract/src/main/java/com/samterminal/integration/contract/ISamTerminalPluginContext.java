package com.samterminal.integration.contract;

import com.samterminal.integration.contract.action.ISamTerminalAction;
import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;

import java.util.Optional;

/**
 * Registration surface handed to a plugin during init. Everything registered here is tagged
 * with the plugin's name and removed again when the plugin is torn down.
 */
public interface ISamTerminalPluginContext {
    String getPluginName();
    void registerAction(ISamTerminalAction action);
    void registerProvider(ISamTerminalDataProvider provider);

    /** Looks up an action by its qualified name, {@code pluginName:actionName}. */
    Optional<ISamTerminalAction> findAction(String qualifiedName);

    /** Looks up a provider by its qualified name, {@code pluginName:providerName}. */
    Optional<ISamTerminalDataProvider> findProvider(String qualifiedName);

    ISamTerminalObjectMapper getObjectMapper();
}
