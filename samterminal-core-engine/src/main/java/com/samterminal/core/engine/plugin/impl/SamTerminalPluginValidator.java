package com.samterminal.core.engine.plugin.impl;

import com.samterminal.core.exception.plugin.SamTerminalInvalidPlugin;
import com.samterminal.core.util.CommonUtil;
import com.samterminal.integration.contract.ISamTerminalPlugin;
import com.samterminal.integration.contract.action.ISamTerminalAction;
import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

final class SamTerminalPluginValidator {

    private SamTerminalPluginValidator() {
    }

    static void validate(ISamTerminalPlugin plugin) {
        if (plugin == null) {
            throw new SamTerminalInvalidPlugin(null, List.of("plugin is null"));
        }

        List<String> problems = new ArrayList<>();
        if (CommonUtil.isNullOrBlank(plugin.getName())) {
            problems.add("name is required");
        }
        if (CommonUtil.isNullOrBlank(plugin.getVersion())) {
            problems.add("version is required");
        }

        Set<String> actionNames = new HashSet<>();
        for (ISamTerminalAction action : Optional.ofNullable(plugin.getActions()).orElse(List.of())) {
            if (CommonUtil.isNullOrBlank(action.getName())) {
                problems.add("action without name");
            } else if (!actionNames.add(action.getName())) {
                problems.add("duplicate action: " + action.getName());
            }
            if (action.getActionFunction() == null) {
                problems.add("action without function: " + action.getName());
            }
        }

        Set<String> providerNames = new HashSet<>();
        for (ISamTerminalDataProvider provider : Optional.ofNullable(plugin.getProviders()).orElse(List.of())) {
            if (CommonUtil.isNullOrBlank(provider.getName())) {
                problems.add("provider without name");
            } else if (!providerNames.add(provider.getName())) {
                problems.add("duplicate provider: " + provider.getName());
            }
        }

        if (!problems.isEmpty()) {
            throw new SamTerminalInvalidPlugin(plugin.getName(), problems);
        }
    }
}
