package com.samterminal.integration;

import com.samterminal.integration.contract.ISamTerminalPlugin;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Factory for a plugin. Implementations are discovered through {@link java.util.ServiceLoader}
 * or handed to the plugin loader directly, optionally together with a configuration map.
 */
@FunctionalInterface
public interface ISamTerminalPluginProvider {
    Mono<ISamTerminalPlugin> create(Map<String, Object> config);
}
