package com.samterminal.integration.contract.provider;

import java.util.Map;

public interface ISamTerminalProviderContext {
    String getPluginName();
    String getProviderName();
    Map<String, Object> getQuery();
}
