package com.samterminal.core.actions.plugin;

import com.samterminal.core.engine.SamTerminalFacade;
import com.samterminal.integration.contract.ISamTerminalPlugin;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Engine with only the core plugin registered and started.
 */
public final class CoreActionsTestEngine {

    private CoreActionsTestEngine() {
    }

    public static SamTerminalFacade start() {
        SamTerminalFacade facade = SamTerminalFacade.create();
        ISamTerminalPlugin plugin = new SamTerminalCoreActionsPlugin().create(Map.of()).block();
        facade.getPluginRegistry().register(plugin);
        facade.getPluginLifecycle().start().block();
        return facade;
    }

    public static Mono<Object> execute(SamTerminalFacade facade, String actionName, Map<String, Object> params) {
        return facade.getActionExecutor()
                .execute(SamTerminalCoreActionsPlugin.PLUGIN_NAME, actionName, params, Map.of(), null)
                .map(result -> result.getData());
    }
}
