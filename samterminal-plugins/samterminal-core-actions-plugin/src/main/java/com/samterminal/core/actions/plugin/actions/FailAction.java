package com.samterminal.core.actions.plugin.actions;

import com.samterminal.integration.contract.ISamTerminalErrorInfo;
import com.samterminal.integration.exception.SamTerminalActionRuntimeException;
import com.samterminal.integration.models.actions.SamTerminalActionDefinition;
import com.samterminal.integration.models.actions.SamTerminalActionOutput;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.Getter;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Always fails. {@code report=true} returns an unsuccessful result instead of raising an error,
 * both end up on the failure edge of the node.
 */
public class FailAction {

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FailActionInput {
        private String message;
        private boolean report;
    }

    @AllArgsConstructor
    @Getter
    public enum FailActionErrorCodes implements ISamTerminalErrorInfo {
        FAIL_ACTION_REQUESTED_FAILURE("CORE_FAIL_001", "Failure requested: {message}", "Remove the fail action from the flow"),
        ;

        private final String errorCode;
        private final String errorTemplate;
        private final String resolutionTemplate;
    }

    public static SamTerminalActionDefinition.BuildStep build(SamTerminalActionDefinition.InitialStepBuilder actionBuilder) {
        return actionBuilder
                .name("fail")
                .description("Fails with the given message")
                .inputType(FailActionInput.class)
                .execute((input, context) -> {
                    FailActionInput failInput = (FailActionInput) input;
                    String message = failInput.getMessage() == null ? "failure requested" : failInput.getMessage();
                    if (failInput.isReport()) {
                        return Mono.just(SamTerminalActionOutput.ofFailure(message));
                    }
                    return Mono.error(new SamTerminalActionRuntimeException(
                            FailActionErrorCodes.FAIL_ACTION_REQUESTED_FAILURE,
                            Map.of("message", message)));
                });
    }
}
