package com.samterminal.core.engine.service.impl;

import com.samterminal.core.engine.service.ISamTerminalServiceRegistry;
import com.samterminal.core.exception.action.SamTerminalActionNotFound;
import com.samterminal.core.exception.action.SamTerminalProviderNotFound;
import com.samterminal.core.models.SamTerminalServiceRegistryStats;
import com.samterminal.integration.constant.SamTerminalConstants;
import com.samterminal.integration.contract.action.ISamTerminalAction;
import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class SamTerminalServiceRegistry implements ISamTerminalServiceRegistry {

    private final Map<String, OwnedService<ISamTerminalAction>> actions = new ConcurrentHashMap<>();
    private final Map<String, OwnedService<ISamTerminalDataProvider>> providers = new ConcurrentHashMap<>();

    @Override
    public void registerAction(String pluginName, ISamTerminalAction action) {
        String qualifiedName = SamTerminalConstants.qualifiedName(pluginName, action.getName());
        OwnedService<ISamTerminalAction> previous = actions.put(qualifiedName, new OwnedService<>(pluginName, action));
        if (previous != null) {
            log.warn("Action already registered, overwriting: [{}]", qualifiedName);
        } else {
            log.debug("Registered action: [{}]", qualifiedName);
        }
    }

    @Override
    public void registerProvider(String pluginName, ISamTerminalDataProvider provider) {
        String qualifiedName = SamTerminalConstants.qualifiedName(pluginName, provider.getName());
        OwnedService<ISamTerminalDataProvider> previous = providers.put(qualifiedName, new OwnedService<>(pluginName, provider));
        if (previous != null) {
            log.warn("Provider already registered, overwriting: [{}]", qualifiedName);
        } else {
            log.debug("Registered provider: [{}]", qualifiedName);
        }
    }

    @Override
    public Optional<ISamTerminalAction> findAction(String qualifiedName) {
        return Optional.ofNullable(actions.get(qualifiedName)).map(OwnedService::service);
    }

    @Override
    public ISamTerminalAction getAction(String pluginName, String actionName) {
        String qualifiedName = SamTerminalConstants.qualifiedName(pluginName, actionName);
        return findAction(qualifiedName).orElseThrow(() -> new SamTerminalActionNotFound(qualifiedName));
    }

    @Override
    public Optional<ISamTerminalDataProvider> findProvider(String qualifiedName) {
        return Optional.ofNullable(providers.get(qualifiedName)).map(OwnedService::service);
    }

    @Override
    public ISamTerminalDataProvider getProvider(String pluginName, String providerName) {
        String qualifiedName = SamTerminalConstants.qualifiedName(pluginName, providerName);
        return findProvider(qualifiedName).orElseThrow(() -> new SamTerminalProviderNotFound(qualifiedName));
    }

    @Override
    public Set<String> getActionNames() {
        return Collections.unmodifiableSet(new TreeSet<>(actions.keySet()));
    }

    @Override
    public Set<String> getProviderNames() {
        return Collections.unmodifiableSet(new TreeSet<>(providers.keySet()));
    }

    @Override
    public int unregisterPlugin(String pluginName) {
        int removed = removeOwnedBy(actions, pluginName) + removeOwnedBy(providers, pluginName);
        log.info("Unregistered services of plugin: [{}], removed: [{}]", pluginName, removed);
        return removed;
    }

    private static <T> int removeOwnedBy(Map<String, OwnedService<T>> services, String pluginName) {
        int removed = 0;
        for (Map.Entry<String, OwnedService<T>> entry : services.entrySet()) {
            if (entry.getValue().pluginName().equals(pluginName) && services.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public SamTerminalServiceRegistryStats getStats() {
        return new SamTerminalServiceRegistryStats(actions.size(), providers.size());
    }

    private record OwnedService<T>(String pluginName, T service) {}
}
