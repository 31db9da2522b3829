package com.samterminal.core.models;

import com.samterminal.integration.contract.provider.ISamTerminalProviderContext;
import lombok.Data;

import java.util.Map;

@Data
public class SamTerminalProviderContext implements ISamTerminalProviderContext {
    private final String pluginName;
    private final String providerName;
    private final Map<String, Object> query;
}
