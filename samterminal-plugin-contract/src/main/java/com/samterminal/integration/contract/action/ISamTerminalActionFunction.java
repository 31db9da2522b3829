package com.samterminal.integration.contract.action;

import com.samterminal.integration.exception.SamTerminalActionRuntimeException;
import reactor.core.publisher.Mono;

@FunctionalInterface
public interface ISamTerminalActionFunction {
    Mono<ISamTerminalActionResult> execute(
            Object input,
            ISamTerminalActionContext context) throws SamTerminalActionRuntimeException;
}
