package com.samterminal.integration.contract;

import com.samterminal.integration.contract.action.ISamTerminalAction;
import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;
import reactor.core.publisher.Mono;

import java.util.List;

public interface ISamTerminalPlugin {
    String getName();
    String getVersion();
    List<String> getDependencies();

    /**
     * Runs once, after every declared dependency finished its own init.
     * Actions and providers registered through the context are owned by this plugin.
     */
    Mono<Void> init(ISamTerminalPluginContext context);

    Mono<Void> destroy();

    default String getDescription() {
        return null;
    }

    default List<ISamTerminalAction> getActions() {
        return List.of();
    }

    default List<ISamTerminalDataProvider> getProviders() {
        return List.of();
    }
}
