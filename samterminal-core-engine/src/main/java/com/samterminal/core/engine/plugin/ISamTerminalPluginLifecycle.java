package com.samterminal.core.engine.plugin;

import com.samterminal.core.models.SamTerminalLifecycleState;
import reactor.core.publisher.Mono;

public interface ISamTerminalPluginLifecycle {

    /**
     * Runs every plugin's init once, sequentially in dependency order. The first failing init
     * aborts the sequence; plugins initialized before it stay active.
     * Configuration errors (missing or circular dependencies) are thrown before any init runs.
     */
    Mono<Void> start();

    /**
     * Runs destroy of every active plugin in reverse init order, then removes its actions and
     * providers. Destroy failures are logged and never fail the returned Mono. Only the first
     * call tears down, later or concurrent calls complete immediately. A stop issued while
     * plugins are still starting waits for the start sequence to settle first.
     */
    Mono<Void> stop();

    SamTerminalLifecycleState getState();

    void addListener(ISamTerminalPluginLifecycleListener listener);

    void removeListener(ISamTerminalPluginLifecycleListener listener);
}
