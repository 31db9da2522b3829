package com.samterminal.core.engine.plugin.impl;

import com.samterminal.core.engine.service.ISamTerminalServiceRegistry;
import com.samterminal.integration.contract.ISamTerminalObjectMapper;
import com.samterminal.integration.contract.ISamTerminalPluginContext;
import com.samterminal.integration.contract.action.ISamTerminalAction;
import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Optional;

/**
 * View of the service registry bound to one plugin, so everything it registers is owned by it.
 */
@AllArgsConstructor
class SamTerminalPluginContext implements ISamTerminalPluginContext {
    @Getter
    private final String pluginName;
    private final ISamTerminalServiceRegistry serviceRegistry;
    @Getter
    private final ISamTerminalObjectMapper objectMapper;

    @Override
    public void registerAction(ISamTerminalAction action) {
        serviceRegistry.registerAction(pluginName, action);
    }

    @Override
    public void registerProvider(ISamTerminalDataProvider provider) {
        serviceRegistry.registerProvider(pluginName, provider);
    }

    @Override
    public Optional<ISamTerminalAction> findAction(String qualifiedName) {
        return serviceRegistry.findAction(qualifiedName);
    }

    @Override
    public Optional<ISamTerminalDataProvider> findProvider(String qualifiedName) {
        return serviceRegistry.findProvider(qualifiedName);
    }
}
