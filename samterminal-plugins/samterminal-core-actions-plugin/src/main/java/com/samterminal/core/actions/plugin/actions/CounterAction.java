package com.samterminal.core.actions.plugin.actions;

import com.samterminal.integration.models.actions.SamTerminalActionDefinition;
import com.samterminal.integration.models.actions.SamTerminalActionOutput;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

public class CounterAction {

    public static SamTerminalActionDefinition.BuildStep build(
            SamTerminalActionDefinition.InitialStepBuilder actionBuilder,
            AtomicLong counter) {

        return actionBuilder
                .name("counter")
                .description("Increments a counter kept by the plugin instance")
                .execute((input, context) -> Mono.fromSupplier(() -> SamTerminalActionOutput.ofData(Map.of("count", counter.incrementAndGet()))));
    }
}
