package com.samterminal.core.actions.plugin.actions;

import com.samterminal.integration.models.actions.SamTerminalActionDefinition;
import com.samterminal.integration.models.actions.SamTerminalActionOutput;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Emits {@code {name: value}} as its data, so the next nodes read it under {@code _lastOutput.<name>}.
 */
public class SetVariableAction {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SetVariableActionInput {
        @NotBlank(message = "name is required")
        private String name;
        private Object value;
    }

    public static SamTerminalActionDefinition.BuildStep build(SamTerminalActionDefinition.InitialStepBuilder actionBuilder) {
        return actionBuilder
                .name("setVariable")
                .description("Outputs a named value")
                .inputType(SetVariableActionInput.class)
                .execute((input, context) -> {
                    SetVariableActionInput setInput = (SetVariableActionInput) input;
                    Map<String, Object> data = new LinkedHashMap<>();
                    data.put(setInput.getName(), setInput.getValue());
                    return Mono.just(SamTerminalActionOutput.ofData(data));
                });
    }
}
