package com.samterminal.core.actions.plugin;

import com.samterminal.core.actions.plugin.actions.CounterAction;
import com.samterminal.core.actions.plugin.actions.EchoAction;
import com.samterminal.core.actions.plugin.actions.FailAction;
import com.samterminal.core.actions.plugin.actions.MathAction;
import com.samterminal.core.actions.plugin.actions.SetVariableAction;
import com.samterminal.core.actions.plugin.providers.ClockProvider;
import com.samterminal.integration.ISamTerminalPluginProvider;
import com.samterminal.integration.contract.ISamTerminalPlugin;
import com.samterminal.integration.models.SamTerminalPlugin;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public class SamTerminalCoreActionsPlugin implements ISamTerminalPluginProvider {

    public static final String PLUGIN_NAME = "core";
    public static final String PLUGIN_VERSION = "1.0.0";

    @Override
    public Mono<ISamTerminalPlugin> create(Map<String, Object> config) {
        // one counter per plugin instance, shared by every flow execution
        AtomicLong counter = new AtomicLong();

        return Mono.just(SamTerminalPlugin
                .builder()
                .name(PLUGIN_NAME)
                .version(PLUGIN_VERSION)
                .description("General purpose actions and providers")
                .actions(builder -> builder
                        .action(EchoAction::build)
                        .action(MathAction::build)
                        .action(FailAction::build)
                        .action(SetVariableAction::build)
                        .action(actionBuilder -> CounterAction.build(actionBuilder, counter))
                )
                .providers(builder -> builder
                        .provider(ClockProvider::build)
                )
                .build());
    }
}
