package com.samterminal.core.engine.plugin;

import com.samterminal.integration.contract.ISamTerminalPlugin;
import reactor.core.publisher.Mono;

import java.util.List;

public interface ISamTerminalPluginLoader {

    Mono<ISamTerminalPlugin> load(SamTerminalPluginSource source);

    /** Loads the sources one after another, failing on the first source that fails. */
    Mono<List<ISamTerminalPlugin>> loadAll(List<SamTerminalPluginSource> sources);

    /**
     * Loads the sources concurrently. A failing source is logged and left out, the result holds
     * the plugins that loaded, in source order.
     */
    Mono<List<ISamTerminalPlugin>> loadParallel(List<SamTerminalPluginSource> sources);

    /** Discovers {@link com.samterminal.integration.ISamTerminalPluginProvider} services and loads them in parallel. */
    Mono<List<ISamTerminalPlugin>> loadFromClasspath(ClassLoader classLoader);

    /** Loads in parallel and registers every loaded plugin, skipping names already registered. */
    Mono<List<ISamTerminalPlugin>> loadAndRegister(List<SamTerminalPluginSource> sources);
}
