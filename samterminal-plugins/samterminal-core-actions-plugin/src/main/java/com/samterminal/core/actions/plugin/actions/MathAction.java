package com.samterminal.core.actions.plugin.actions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.samterminal.integration.contract.ISamTerminalErrorInfo;
import com.samterminal.integration.exception.SamTerminalActionRuntimeException;
import com.samterminal.integration.models.actions.SamTerminalActionDefinition;
import com.samterminal.integration.models.actions.SamTerminalActionOutput;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.Map;

public class MathAction {

    @Getter
    @AllArgsConstructor
    public enum MathOperation {
        ADD("add"),
        SUBTRACT("subtract"),
        MULTIPLY("multiply"),
        DIVIDE("divide"),
        PERCENT_CHANGE("percentChange");

        @JsonValue
        private final String value;

        @JsonCreator
        public static MathOperation fromValue(String value) {
            return Arrays.stream(values())
                    .filter(v -> v.value.equalsIgnoreCase(value) || v.name().equalsIgnoreCase(value))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown MathOperation: [" + value + "]"));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MathActionInput {
        @NotNull(message = "operation is required")
        private MathOperation operation;
        @NotNull(message = "left is required")
        private Double left;
        @NotNull(message = "right is required")
        private Double right;
    }

    @AllArgsConstructor
    @Getter
    public enum MathActionErrorCodes implements ISamTerminalErrorInfo {
        MATH_ACTION_DIVISION_BY_ZERO("CORE_MATH_001", "Division by zero", "Use a non zero right operand"),
        MATH_ACTION_PERCENT_CHANGE_FROM_ZERO("CORE_MATH_002", "Percent change from zero is undefined", "Use a non zero left operand"),
        ;

        private final String errorCode;
        private final String errorTemplate;
        private final String resolutionTemplate;
    }

    public static SamTerminalActionDefinition.BuildStep build(SamTerminalActionDefinition.InitialStepBuilder actionBuilder) {
        return actionBuilder
                .name("math")
                .description("Arithmetic on two numbers")
                .inputType(MathActionInput.class)
                .validateInput(input -> {
                    MathActionInput mathInput = (MathActionInput) input;
                    if (mathInput.getOperation() == MathOperation.DIVIDE && mathInput.getRight() == 0) {
                        throw new SamTerminalActionRuntimeException(MathActionErrorCodes.MATH_ACTION_DIVISION_BY_ZERO);
                    }
                })
                .execute((input, context) -> {
                    MathActionInput mathInput = (MathActionInput) input;
                    double result = calculate(mathInput);
                    return Mono.just(SamTerminalActionOutput.ofData(Map.of(
                            "operation", mathInput.getOperation().getValue(),
                            "result", result)));
                });
    }

    private static double calculate(MathActionInput input) {
        double left = input.getLeft();
        double right = input.getRight();
        switch (input.getOperation()) {
            case ADD:
                return left + right;
            case SUBTRACT:
                return left - right;
            case MULTIPLY:
                return left * right;
            case DIVIDE:
                return left / right;
            case PERCENT_CHANGE:
                if (left == 0) {
                    throw new SamTerminalActionRuntimeException(MathActionErrorCodes.MATH_ACTION_PERCENT_CHANGE_FROM_ZERO);
                }
                return (right - left) / left * 100;
            default:
                throw new IllegalArgumentException("Unsupported operation: " + input.getOperation());
        }
    }
}
