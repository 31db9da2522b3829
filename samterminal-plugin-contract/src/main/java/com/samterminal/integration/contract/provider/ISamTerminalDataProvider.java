package com.samterminal.integration.contract.provider;

public interface ISamTerminalDataProvider {
    String getName();
    String getDescription();
    ISamTerminalProviderFunction getProviderFunction();
}
