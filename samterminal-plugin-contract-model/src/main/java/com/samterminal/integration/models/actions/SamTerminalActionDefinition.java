package com.samterminal.integration.models.actions;

import com.samterminal.integration.contract.action.ISamTerminalAction;
import com.samterminal.integration.contract.action.ISamTerminalActionFunction;
import com.samterminal.integration.contract.action.ISamTerminalActionInputValidator;
import lombok.Data;

import java.util.Map;

@Data
public class SamTerminalActionDefinition implements ISamTerminalAction {
    private final String name;
    private final String description;
    private final Class<?> inputType;
    private final ISamTerminalActionInputValidator inputValidator;
    private final ISamTerminalActionFunction actionFunction;

    // Guided builder
    public static InitialStepBuilder builder() { return new Builder(); }

    public interface InitialStepBuilder { DescriptionStep name(String name); }
    public interface DescriptionStep { InputTypeStep description(String description); }
    public interface InputTypeStep extends ExecuteStep { InputValidatorStep inputType(Class<?> inputType); }
    public interface InputValidatorStep extends ExecuteStep { ExecuteStep validateInput(ISamTerminalActionInputValidator validator); }
    public interface ExecuteStep { BuildStep execute(ISamTerminalActionFunction actionFunction); }
    public interface BuildStep { SamTerminalActionDefinition build(); }

    private static class Builder implements InitialStepBuilder, DescriptionStep, InputTypeStep, InputValidatorStep, ExecuteStep, BuildStep {
        private String name;
        private String description;
        private Class<?> inputType = Map.class;
        private ISamTerminalActionInputValidator inputValidator = ISamTerminalActionInputValidator.NOOP;
        private ISamTerminalActionFunction actionFunction;

        @Override
        public DescriptionStep name(String name) { this.name = name; return this; }
        @Override
        public InputTypeStep description(String description) { this.description = description; return this; }
        @Override
        public InputValidatorStep inputType(Class<?> inputType) { this.inputType = inputType; return this; }
        @Override
        public ExecuteStep validateInput(ISamTerminalActionInputValidator validator) { this.inputValidator = validator; return this; }
        @Override
        public BuildStep execute(ISamTerminalActionFunction actionFunction) { this.actionFunction = actionFunction; return this; }
        @Override
        public SamTerminalActionDefinition build() {
            return new SamTerminalActionDefinition(name, description, inputType, inputValidator, actionFunction);
        }
    }
}
