package com.samterminal.core.engine.plugin.impl;

import com.samterminal.core.engine.plugin.ISamTerminalPluginRegistry;
import com.samterminal.core.exception.plugin.SamTerminalPluginAlreadyRegistered;
import com.samterminal.core.exception.plugin.SamTerminalPluginCircularDependency;
import com.samterminal.core.exception.plugin.SamTerminalPluginDependencyMissing;
import com.samterminal.core.exception.plugin.SamTerminalPluginInUse;
import com.samterminal.core.exception.plugin.SamTerminalPluginNotFound;
import com.samterminal.core.models.SamTerminalPluginRegistrationOptions;
import com.samterminal.core.models.SamTerminalPluginState;
import com.samterminal.integration.contract.ISamTerminalPlugin;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class SamTerminalPluginRegistry implements ISamTerminalPluginRegistry {

    private static final Comparator<SamTerminalPluginDescriptor> INIT_PREFERENCE = Comparator
            .comparingInt(SamTerminalPluginDescriptor::getPriority).reversed()
            .thenComparing(SamTerminalPluginDescriptor::getName);

    private final Map<String, SamTerminalPluginDescriptor> descriptors = new ConcurrentHashMap<>();

    @Override
    public void register(ISamTerminalPlugin plugin) {
        register(plugin, SamTerminalPluginRegistrationOptions.DEFAULT);
    }

    @Override
    public void register(ISamTerminalPlugin plugin, SamTerminalPluginRegistrationOptions options) {
        SamTerminalPluginValidator.validate(plugin);

        SamTerminalPluginDescriptor descriptor = new SamTerminalPluginDescriptor(plugin, options.getPriority());
        SamTerminalPluginDescriptor existing = descriptors.putIfAbsent(plugin.getName(), descriptor);
        if (existing != null) {
            throw new SamTerminalPluginAlreadyRegistered(plugin.getName(), existing.getPlugin().getVersion(), plugin.getVersion());
        }
        log.info("Registered plugin: [{}], version: [{}], dependencies: {}", plugin.getName(), plugin.getVersion(), descriptor.getDependencies());
    }

    @Override
    public void unregister(String name) {
        getDescriptor(name);
        List<String> dependents = getDependents(name);
        if (!dependents.isEmpty()) {
            throw new SamTerminalPluginInUse(name, dependents);
        }
        descriptors.remove(name);
        log.info("Unregistered plugin: [{}]", name);
    }

    @Override
    public ISamTerminalPlugin get(String name) {
        return getDescriptor(name).getPlugin();
    }

    @Override
    public boolean has(String name) {
        return descriptors.containsKey(name);
    }

    @Override
    public List<ISamTerminalPlugin> getAll() {
        return sortedDescriptors().stream().map(SamTerminalPluginDescriptor::getPlugin).toList();
    }

    @Override
    public Set<String> getNames() {
        return Collections.unmodifiableSet(new TreeSet<>(descriptors.keySet()));
    }

    @Override
    public SamTerminalPluginState getState(String name) {
        return getDescriptor(name).getState();
    }

    @Override
    public int size() {
        return descriptors.size();
    }

    @Override
    public List<String> getDependents(String name) {
        return sortedDescriptors().stream()
                .filter(descriptor -> descriptor.getDependencies().contains(name))
                .map(SamTerminalPluginDescriptor::getName)
                .toList();
    }

    @Override
    public List<String> getMissingDependencies(String name) {
        return getDescriptor(name).getDependencies().stream()
                .filter(dependency -> !descriptors.containsKey(dependency))
                .toList();
    }

    @Override
    public Map<String, List<String>> getMissingDependencies() {
        return missingDependencies(new LinkedHashMap<>(descriptors));
    }

    private static Map<String, List<String>> missingDependencies(Map<String, SamTerminalPluginDescriptor> snapshot) {
        Map<String, List<String>> missing = new LinkedHashMap<>();
        for (SamTerminalPluginDescriptor descriptor : sorted(snapshot)) {
            List<String> missingOfPlugin = descriptor.getDependencies().stream()
                    .filter(dependency -> !snapshot.containsKey(dependency))
                    .toList();
            if (!missingOfPlugin.isEmpty()) {
                missing.put(descriptor.getName(), missingOfPlugin);
            }
        }
        return missing;
    }

    @Override
    public List<String> getLoadOrder() {
        // registrations may change concurrently, the check and the ordering both read this copy
        Map<String, SamTerminalPluginDescriptor> snapshot = new LinkedHashMap<>(descriptors);
        Map<String, List<String>> missing = missingDependencies(snapshot);
        if (!missing.isEmpty()) {
            throw new SamTerminalPluginDependencyMissing(missing);
        }

        List<String> order = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        LinkedHashSet<String> visiting = new LinkedHashSet<>();
        for (SamTerminalPluginDescriptor descriptor : sorted(snapshot)) {
            visit(descriptor.getName(), snapshot, visited, visiting, order);
        }
        return Collections.unmodifiableList(order);
    }

    // depth first, a plugin is appended after all of its dependencies
    private void visit(
            String name,
            Map<String, SamTerminalPluginDescriptor> snapshot,
            Set<String> visited,
            LinkedHashSet<String> visiting,
            List<String> order) {

        if (visited.contains(name)) {
            return;
        }
        if (visiting.contains(name)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String onPath : visiting) {
                inCycle = inCycle || onPath.equals(name);
                if (inCycle) {
                    cycle.add(onPath);
                }
            }
            cycle.add(name);
            throw new SamTerminalPluginCircularDependency(cycle);
        }

        visiting.add(name);
        snapshot.get(name).getDependencies().stream()
                .map(snapshot::get)
                .sorted(INIT_PREFERENCE)
                .forEach(dependency -> visit(dependency.getName(), snapshot, visited, visiting, order));
        visiting.remove(name);

        visited.add(name);
        order.add(name);
    }

    private List<SamTerminalPluginDescriptor> sortedDescriptors() {
        return sorted(descriptors);
    }

    private static List<SamTerminalPluginDescriptor> sorted(Map<String, SamTerminalPluginDescriptor> source) {
        return source.values().stream().sorted(INIT_PREFERENCE).toList();
    }

    private SamTerminalPluginDescriptor getDescriptor(String name) {
        SamTerminalPluginDescriptor descriptor = name == null ? null : descriptors.get(name);
        if (descriptor == null) {
            throw new SamTerminalPluginNotFound(name);
        }
        return descriptor;
    }
}
