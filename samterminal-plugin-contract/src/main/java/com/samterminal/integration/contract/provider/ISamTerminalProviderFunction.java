package com.samterminal.integration.contract.provider;

import reactor.core.publisher.Mono;

@FunctionalInterface
public interface ISamTerminalProviderFunction {
    Mono<ISamTerminalProviderResult> get(ISamTerminalProviderContext context);
}
