package com.samterminal.core.engine.plugin.impl;

import com.samterminal.core.engine.plugin.ISamTerminalPluginLifecycle;
import com.samterminal.core.engine.plugin.ISamTerminalPluginLifecycleListener;
import com.samterminal.core.engine.plugin.ISamTerminalPluginRegistry;
import com.samterminal.core.engine.service.ISamTerminalServiceRegistry;
import com.samterminal.core.exception.plugin.SamTerminalLifecycleStateException;
import com.samterminal.core.models.SamTerminalLifecycleState;
import com.samterminal.core.models.SamTerminalPluginState;
import com.samterminal.integration.contract.ISamTerminalObjectMapper;
import com.samterminal.integration.contract.ISamTerminalPlugin;
import com.samterminal.integration.contract.ISamTerminalPluginContext;
import com.samterminal.integration.contract.action.ISamTerminalAction;
import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;
import com.samterminal.integration.enumerations.SamTerminalLifecycleEvent;
import com.samterminal.integration.enumerations.SamTerminalPluginStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
public class SamTerminalPluginLifecycle implements ISamTerminalPluginLifecycle {

    private final ISamTerminalPluginRegistry pluginRegistry;
    private final ISamTerminalServiceRegistry serviceRegistry;
    private final ISamTerminalObjectMapper objectMapper;

    private final AtomicReference<SamTerminalLifecycleState> state = new AtomicReference<>(SamTerminalLifecycleState.IDLE);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final List<ISamTerminalPluginLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final List<String> initializedPlugins = new CopyOnWriteArrayList<>();
    // completes once a start sequence has settled, whatever its outcome
    private final Sinks.Empty<Void> startSettled = Sinks.empty();

    public SamTerminalPluginLifecycle(
            ISamTerminalPluginRegistry pluginRegistry,
            ISamTerminalServiceRegistry serviceRegistry,
            ISamTerminalObjectMapper objectMapper) {

        this.pluginRegistry = pluginRegistry;
        this.serviceRegistry = serviceRegistry;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> start() {
        return Mono.defer(() -> {
            SamTerminalLifecycleState current = state.get();
            if (current != SamTerminalLifecycleState.IDLE || stopRequested.get()) {
                return Mono.error(new SamTerminalLifecycleStateException(current, "start"));
            }

            List<String> loadOrder = pluginRegistry.getLoadOrder();
            if (!state.compareAndSet(SamTerminalLifecycleState.IDLE, SamTerminalLifecycleState.STARTING)) {
                return Mono.error(new SamTerminalLifecycleStateException(state.get(), "start"));
            }
            log.info("Starting plugins in order: {}", loadOrder);

            return Flux.fromIterable(loadOrder)
                    .concatMap(this::initPlugin)
                    .then()
                    .doOnSuccess(ignored -> {
                        state.compareAndSet(SamTerminalLifecycleState.STARTING, SamTerminalLifecycleState.STARTED);
                        log.info("Started plugins: {}", initializedPlugins);
                    })
                    .doOnError(throwable -> {
                        state.compareAndSet(SamTerminalLifecycleState.STARTING, SamTerminalLifecycleState.FAILED);
                        log.error("Plugin startup aborted, initialized so far: {}", initializedPlugins, throwable);
                    })
                    .doOnCancel(() -> {
                        state.compareAndSet(SamTerminalLifecycleState.STARTING, SamTerminalLifecycleState.FAILED);
                        log.warn("Plugin startup cancelled, initialized so far: {}", initializedPlugins);
                    })
                    .doFinally(signal -> startSettled.tryEmitEmpty());
        });
    }

    private Mono<Void> initPlugin(String pluginName) {
        ISamTerminalPlugin plugin = pluginRegistry.get(pluginName);
        SamTerminalPluginState pluginState = pluginRegistry.getState(pluginName);
        ISamTerminalPluginContext context = new SamTerminalPluginContext(pluginName, serviceRegistry, objectMapper);

        return Mono.just(plugin)
                .doOnNext(p -> {
                    pluginState.setStatus(SamTerminalPluginStatus.INITIALIZING);
                    fireEvent(SamTerminalLifecycleEvent.BEFORE_INIT, p, null);
                    log.info("Initializing plugin: [{}]", pluginName);
                })
                .flatMap(p -> Mono.defer(() -> p.init(context)))
                .then(Mono.fromRunnable(() -> registerDeclaredServices(plugin, context)))
                .doOnSuccess(ignored -> {
                    pluginState.setStatus(SamTerminalPluginStatus.ACTIVE);
                    pluginState.setInitializedAt(Instant.now());
                    initializedPlugins.add(pluginName);
                    fireEvent(SamTerminalLifecycleEvent.AFTER_INIT, plugin, null);
                    log.info("Initialized plugin: [{}]", pluginName);
                })
                .doOnError(throwable -> {
                    pluginState.setStatus(SamTerminalPluginStatus.ERROR);
                    pluginState.setError(throwable);
                    fireEvent(SamTerminalLifecycleEvent.ERROR, plugin, throwable);
                    log.error("Failed to initialize plugin: [{}]", pluginName, throwable);
                })
                .then();
    }

    private void registerDeclaredServices(ISamTerminalPlugin plugin, ISamTerminalPluginContext context) {
        for (ISamTerminalAction action : Optional.ofNullable(plugin.getActions()).orElse(List.of())) {
            context.registerAction(action);
        }
        for (ISamTerminalDataProvider provider : Optional.ofNullable(plugin.getProviders()).orElse(List.of())) {
            context.registerProvider(provider);
        }
    }

    @Override
    public Mono<Void> stop() {
        return Mono.defer(() -> {
            if (!stopRequested.compareAndSet(false, true)) {
                return Mono.empty();
            }
            return awaitPendingStart().then(Mono.defer(this::tearDown));
        });
    }

    private Mono<Void> awaitPendingStart() {
        if (state.get() != SamTerminalLifecycleState.STARTING) {
            return Mono.empty();
        }
        log.info("Stop requested while starting, waiting for the start sequence to settle");
        return startSettled.asMono();
    }

    private Mono<Void> tearDown() {
        List<String> reverseOrder = new ArrayList<>(initializedPlugins);
        Collections.reverse(reverseOrder);
        log.info("Stopping plugins in order: {}", reverseOrder);

        return Flux.fromIterable(reverseOrder)
                .concatMap(this::destroyPlugin)
                .then(Mono.fromRunnable(() -> {
                    cleanupFailedPlugins();
                    initializedPlugins.clear();
                    state.set(SamTerminalLifecycleState.STOPPED);
                    log.info("Stopped plugins");
                }));
    }

    private Mono<Void> destroyPlugin(String pluginName) {
        ISamTerminalPlugin plugin = pluginRegistry.get(pluginName);
        SamTerminalPluginState pluginState = pluginRegistry.getState(pluginName);

        return Mono.just(plugin)
                .doOnNext(p -> {
                    fireEvent(SamTerminalLifecycleEvent.BEFORE_DESTROY, p, null);
                    log.info("Destroying plugin: [{}]", pluginName);
                })
                .flatMap(p -> Mono.defer(p::destroy))
                .then(Mono.fromRunnable(() -> {
                    pluginState.setStatus(SamTerminalPluginStatus.DESTROYED);
                    fireEvent(SamTerminalLifecycleEvent.AFTER_DESTROY, plugin, null);
                }))
                .onErrorResume(throwable -> {
                    log.warn("Failed to destroy plugin: [{}], continuing", pluginName, throwable);
                    pluginState.setStatus(SamTerminalPluginStatus.ERROR);
                    pluginState.setError(throwable);
                    fireEvent(SamTerminalLifecycleEvent.ERROR, plugin, throwable);
                    return Mono.empty();
                })
                .then(Mono.fromRunnable(() -> {
                    int removed = serviceRegistry.unregisterPlugin(pluginName);
                    log.debug("Removed services of plugin: [{}], Count: [{}]", pluginName, removed);
                }));
    }

    // a plugin whose init failed may have registered services before failing
    private void cleanupFailedPlugins() {
        for (String pluginName : pluginRegistry.getNames()) {
            SamTerminalPluginState pluginState = pluginRegistry.getState(pluginName);
            if (pluginState.getStatus() == SamTerminalPluginStatus.ERROR && !initializedPlugins.contains(pluginName)) {
                serviceRegistry.unregisterPlugin(pluginName);
            }
        }
    }

    @Override
    public SamTerminalLifecycleState getState() {
        return state.get();
    }

    @Override
    public void addListener(ISamTerminalPluginLifecycleListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(ISamTerminalPluginLifecycleListener listener) {
        listeners.remove(listener);
    }

    private void fireEvent(SamTerminalLifecycleEvent event, ISamTerminalPlugin plugin, Throwable error) {
        for (ISamTerminalPluginLifecycleListener listener : listeners) {
            try {
                listener.onEvent(event, plugin, error);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener failed, Event: [{}], Plugin: [{}]", event, plugin.getName(), e);
            }
        }
    }
}
