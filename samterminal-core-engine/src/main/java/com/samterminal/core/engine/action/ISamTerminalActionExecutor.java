package com.samterminal.core.engine.action;

import com.samterminal.core.exception.action.SamTerminalActionExecutionException;
import com.samterminal.integration.contract.action.ISamTerminalActionResult;
import com.samterminal.integration.contract.provider.ISamTerminalProviderResult;
import reactor.core.publisher.Mono;

import java.util.Map;

public interface ISamTerminalActionExecutor {

    /**
     * Invokes a registered action. Emits only successful results: a thrown error and a result
     * with {@code success=false} both end in a {@link SamTerminalActionExecutionException}.
     *
     * @param executionId id of the calling flow execution, {@code null} for direct calls
     */
    Mono<ISamTerminalActionResult> execute(
            String pluginName,
            String actionName,
            Map<String, Object> params,
            Map<String, Object> variables,
            String executionId);

    /**
     * Queries a registered provider. Provider failures are reported as {@code success=false}
     * results rather than errors.
     */
    Mono<ISamTerminalProviderResult> getData(
            String pluginName,
            String providerName,
            Map<String, Object> query);
}
