package com.samterminal.core.engine.plugin.impl;

import com.samterminal.core.engine.plugin.ISamTerminalPluginLoader;
import com.samterminal.core.engine.plugin.ISamTerminalPluginRegistry;
import com.samterminal.core.engine.plugin.SamTerminalPluginSource;
import com.samterminal.core.exception.plugin.SamTerminalInvalidPlugin;
import com.samterminal.core.exception.plugin.SamTerminalPluginAlreadyRegistered;
import com.samterminal.integration.ISamTerminalPluginProvider;
import com.samterminal.integration.contract.ISamTerminalPlugin;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
public class SamTerminalPluginLoader implements ISamTerminalPluginLoader {

    private final ISamTerminalPluginRegistry pluginRegistry;

    public SamTerminalPluginLoader(ISamTerminalPluginRegistry pluginRegistry) {
        this.pluginRegistry = pluginRegistry;
    }

    @Override
    public Mono<ISamTerminalPlugin> load(SamTerminalPluginSource source) {
        return Mono.defer(() -> source.isFactory()
                        ? source.getProvider().create(source.getConfig())
                        : Mono.justOrEmpty(source.getInstance()))
                .switchIfEmpty(Mono.error(() -> new SamTerminalInvalidPlugin(null, List.of("source produced no plugin: " + source))))
                .doOnNext(SamTerminalPluginValidator::validate)
                .doOnNext(plugin -> log.info("Loaded plugin: [{}], version: [{}]", plugin.getName(), plugin.getVersion()));
    }

    @Override
    public Mono<List<ISamTerminalPlugin>> loadAll(List<SamTerminalPluginSource> sources) {
        return Flux.fromIterable(sources)
                .concatMap(this::load)
                .collectList();
    }

    @Override
    public Mono<List<ISamTerminalPlugin>> loadParallel(List<SamTerminalPluginSource> sources) {
        AtomicInteger failures = new AtomicInteger();
        return Flux.fromIterable(sources)
                .flatMapSequential(source -> load(source)
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(throwable -> {
                            failures.incrementAndGet();
                            log.warn("Failed to load plugin from source: [{}]", source, throwable);
                            return Mono.empty();
                        }))
                .collectList()
                .doOnNext(plugins -> log.info("Loaded plugins in parallel, Loaded: [{}], Failed: [{}]", plugins.size(), failures.get()));
    }

    @Override
    public Mono<List<ISamTerminalPlugin>> loadFromClasspath(ClassLoader classLoader) {
        return Mono.fromCallable(() -> {
                    List<SamTerminalPluginSource> sources = new ArrayList<>();
                    for (ISamTerminalPluginProvider provider : ServiceLoader.load(ISamTerminalPluginProvider.class, classLoader)) {
                        sources.add(SamTerminalPluginSource.ofFactory(provider));
                    }
                    log.info("Discovered plugin providers on classpath: [{}]", sources.size());
                    return sources;
                })
                .flatMap(this::loadParallel);
    }

    @Override
    public Mono<List<ISamTerminalPlugin>> loadAndRegister(List<SamTerminalPluginSource> sources) {
        return loadParallel(sources)
                .map(plugins -> {
                    List<ISamTerminalPlugin> registered = new ArrayList<>();
                    for (ISamTerminalPlugin plugin : plugins) {
                        try {
                            pluginRegistry.register(plugin);
                            registered.add(plugin);
                        } catch (SamTerminalPluginAlreadyRegistered e) {
                            log.warn("Plugin already registered: [{}]", e.getPluginName());
                        }
                    }
                    return registered;
                });
    }
}
