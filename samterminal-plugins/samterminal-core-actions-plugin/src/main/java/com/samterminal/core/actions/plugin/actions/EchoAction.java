package com.samterminal.core.actions.plugin.actions;

import com.samterminal.integration.models.actions.SamTerminalActionDefinition;
import com.samterminal.integration.models.actions.SamTerminalActionOutput;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;

/**
 * Returns its params as data.
 */
public class EchoAction {

    public static SamTerminalActionDefinition.BuildStep build(SamTerminalActionDefinition.InitialStepBuilder actionBuilder) {
        return actionBuilder
                .name("echo")
                .description("Returns the given params")
                .execute((input, context) -> Mono.just(SamTerminalActionOutput.ofData(new LinkedHashMap<>(context.getParams()))));
    }
}
