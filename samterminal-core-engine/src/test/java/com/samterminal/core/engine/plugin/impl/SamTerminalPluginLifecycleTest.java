package com.samterminal.core.engine.plugin.impl;

import com.samterminal.core.engine.misc.SamTerminalObjectMapper;
import com.samterminal.core.engine.service.impl.SamTerminalServiceRegistry;
import com.samterminal.core.exception.plugin.SamTerminalLifecycleStateException;
import com.samterminal.core.exception.plugin.SamTerminalPluginDependencyMissing;
import com.samterminal.core.models.SamTerminalLifecycleState;
import com.samterminal.integration.contract.ISamTerminalPlugin;
import com.samterminal.integration.enumerations.SamTerminalLifecycleEvent;
import com.samterminal.integration.enumerations.SamTerminalPluginStatus;
import com.samterminal.integration.models.SamTerminalPlugin;
import com.samterminal.integration.models.actions.SamTerminalActionOutput;
import com.samterminal.integration.models.providers.SamTerminalProviderOutput;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class SamTerminalPluginLifecycleTest {

    private SamTerminalPluginRegistry pluginRegistry;
    private SamTerminalServiceRegistry serviceRegistry;
    private SamTerminalPluginLifecycle lifecycle;

    // "init:a", "destroy:a", ... in the order the hooks ran
    private List<String> calls;
    private Map<String, AtomicInteger> destroyCounts;

    @BeforeEach
    void setUp() {
        pluginRegistry = new SamTerminalPluginRegistry();
        serviceRegistry = new SamTerminalServiceRegistry();
        lifecycle = new SamTerminalPluginLifecycle(pluginRegistry, serviceRegistry, new SamTerminalObjectMapper());
        calls = new CopyOnWriteArrayList<>();
        destroyCounts = new ConcurrentHashMap<>();
    }

    private ISamTerminalPlugin tracked(String name, String... dependencies) {
        return trackedWith(name, Mono.empty(), Mono.empty(), dependencies);
    }

    private ISamTerminalPlugin trackedWith(String name, Mono<Void> initResult, Mono<Void> destroyResult, String... dependencies) {
        return SamTerminalPlugin.builder()
                .name(name)
                .version("1.0.0")
                .dependencies(dependencies)
                .actions(actions -> actions
                        .action(action -> action
                                .name("ping")
                                .description("answers pong")
                                .execute((input, context) -> Mono.just(SamTerminalActionOutput.ofData("pong")))))
                .providers(providers -> providers
                        .provider(provider -> provider
                                .name("status")
                                .description("constant status")
                                .get(context -> Mono.just(SamTerminalProviderOutput.ofData("ok")))))
                .onInit(context -> {
                    calls.add("init:" + name);
                    return initResult;
                })
                .onDestroy(() -> {
                    calls.add("destroy:" + name);
                    destroyCounts.computeIfAbsent(name, key -> new AtomicInteger()).incrementAndGet();
                    return destroyResult;
                })
                .build();
    }

    private void registerDiamond() {
        pluginRegistry.register(tracked("d", "b", "c"));
        pluginRegistry.register(tracked("c", "a"));
        pluginRegistry.register(tracked("b", "a"));
        pluginRegistry.register(tracked("a"));
    }

    @Nested
    @DisplayName("Start")
    class StartTests {

        @Test
        @DisplayName("should init plugins in dependency order and register their services")
        void shouldInitInDependencyOrder() {
            // Given
            registerDiamond();

            // When
            StepVerifier.create(lifecycle.start()).verifyComplete();

            // Then
            assertEquals(List.of("init:a", "init:b", "init:c", "init:d"), calls);
            assertEquals(SamTerminalLifecycleState.STARTED, lifecycle.getState());
            assertEquals(SamTerminalPluginStatus.ACTIVE, pluginRegistry.getState("d").getStatus());
            assertNotNull(pluginRegistry.getState("d").getInitializedAt());
            assertTrue(serviceRegistry.findAction("a:ping").isPresent());
            assertTrue(serviceRegistry.findProvider("d:status").isPresent());
            assertEquals(4, serviceRegistry.getStats().actionCount());
        }

        @Test
        @DisplayName("should let a plugin use its dependency's actions during init")
        void shouldExposeDependencyActionsDuringInit() {
            // Given
            AtomicBoolean sawDependencyAction = new AtomicBoolean();
            pluginRegistry.register(tracked("wallet"));
            pluginRegistry.register(SamTerminalPlugin.builder()
                    .name("swap")
                    .version("1.0.0")
                    .dependencies("wallet")
                    .onInit(context -> Mono.fromRunnable(() ->
                            sawDependencyAction.set(context.findAction("wallet:ping").isPresent())))
                    .build());

            // When
            lifecycle.start().block();

            // Then
            assertTrue(sawDependencyAction.get());
        }

        @Test
        @DisplayName("should abort on the first failing init and leave earlier plugins active")
        void shouldAbortOnInitFailure() {
            // Given
            pluginRegistry.register(tracked("a"));
            pluginRegistry.register(trackedWith("b", Mono.error(new IllegalStateException("no rpc")), Mono.empty(), "a"));
            pluginRegistry.register(tracked("c", "b"));

            // When
            StepVerifier.create(lifecycle.start())
                    .expectErrorMatches(throwable -> throwable instanceof IllegalStateException
                            && "no rpc".equals(throwable.getMessage()))
                    .verify();

            // Then
            assertEquals(List.of("init:a", "init:b"), calls);
            assertEquals(SamTerminalLifecycleState.FAILED, lifecycle.getState());
            assertEquals(SamTerminalPluginStatus.ACTIVE, pluginRegistry.getState("a").getStatus());
            assertEquals(SamTerminalPluginStatus.ERROR, pluginRegistry.getState("b").getStatus());
            assertInstanceOf(IllegalStateException.class, pluginRegistry.getState("b").getError());
            assertEquals(SamTerminalPluginStatus.REGISTERED, pluginRegistry.getState("c").getStatus());
        }

        @Test
        @DisplayName("should fail before any init when a dependency is missing")
        void shouldFailBeforeInitOnMissingDependency() {
            pluginRegistry.register(tracked("swap", "wallet"));

            StepVerifier.create(lifecycle.start())
                    .expectError(SamTerminalPluginDependencyMissing.class)
                    .verify();

            assertTrue(calls.isEmpty());
            assertEquals(SamTerminalLifecycleState.IDLE, lifecycle.getState());
        }

        @Test
        @DisplayName("should refuse a second start")
        void shouldRefuseSecondStart() {
            pluginRegistry.register(tracked("a"));
            lifecycle.start().block();

            StepVerifier.create(lifecycle.start())
                    .expectError(SamTerminalLifecycleStateException.class)
                    .verify();

            assertEquals(List.of("init:a"), calls);
        }
    }

    @Nested
    @DisplayName("Stop")
    class StopTests {

        @Test
        @DisplayName("should destroy in exact reverse init order and remove services")
        void shouldDestroyInReverseOrder() {
            // Given
            registerDiamond();
            lifecycle.start().block();
            calls.clear();

            // When
            StepVerifier.create(lifecycle.stop()).verifyComplete();

            // Then
            assertEquals(List.of("destroy:d", "destroy:c", "destroy:b", "destroy:a"), calls);
            assertEquals(SamTerminalLifecycleState.STOPPED, lifecycle.getState());
            assertEquals(SamTerminalPluginStatus.DESTROYED, pluginRegistry.getState("a").getStatus());
            assertTrue(serviceRegistry.getActionNames().isEmpty());
            assertTrue(serviceRegistry.getProviderNames().isEmpty());
        }

        @Test
        @DisplayName("should destroy each plugin once however often stop is called")
        void shouldDestroyOnce() {
            // Given
            registerDiamond();
            lifecycle.start().block();

            // When
            for (int i = 0; i < 3; i++) {
                lifecycle.stop().block();
            }

            // Then
            assertEquals(4, destroyCounts.size());
            destroyCounts.forEach((name, count) -> assertEquals(1, count.get(), name));
        }

        @Test
        @DisplayName("should keep destroying the rest when one destroy fails")
        void shouldIsolateDestroyFailures() {
            // Given
            pluginRegistry.register(tracked("a"));
            pluginRegistry.register(trackedWith("b", Mono.empty(), Mono.error(new IllegalStateException("stuck")), "a"));
            pluginRegistry.register(tracked("c", "b"));
            lifecycle.start().block();
            calls.clear();

            // When
            StepVerifier.create(lifecycle.stop()).verifyComplete();

            // Then
            assertEquals(List.of("destroy:c", "destroy:b", "destroy:a"), calls);
            assertEquals(SamTerminalPluginStatus.ERROR, pluginRegistry.getState("b").getStatus());
            assertEquals(SamTerminalPluginStatus.DESTROYED, pluginRegistry.getState("a").getStatus());
            assertFalse(serviceRegistry.findAction("b:ping").isPresent());
        }

        @Test
        @DisplayName("should only destroy plugins that finished init after a failed start")
        void shouldDestroyOnlyInitializedAfterFailure() {
            // Given
            pluginRegistry.register(tracked("a"));
            pluginRegistry.register(trackedWith("b", Mono.error(new IllegalStateException("no rpc")), Mono.empty(), "a"));
            StepVerifier.create(lifecycle.start()).expectError().verify();
            calls.clear();

            // When
            lifecycle.stop().block();

            // Then
            assertEquals(List.of("destroy:a"), calls);
            assertTrue(serviceRegistry.getActionNames().isEmpty());
        }

        @Test
        @DisplayName("should wait for a start in progress before tearing down")
        void shouldWaitForPendingStart() {
            // Given
            pluginRegistry.register(tracked("a"));
            pluginRegistry.register(trackedWith("slow", Mono.delay(Duration.ofMillis(200)).then(), Mono.empty(), "a"));
            lifecycle.start().subscribe();
            assertEquals(SamTerminalLifecycleState.STARTING, lifecycle.getState());

            // When
            lifecycle.stop().block(Duration.ofSeconds(5));
            lifecycle.stop().block(Duration.ofSeconds(5));

            // Then
            assertEquals(List.of("init:a", "init:slow", "destroy:slow", "destroy:a"), calls);
            assertEquals(1, destroyCounts.get("slow").get());
            assertEquals(SamTerminalPluginStatus.DESTROYED, pluginRegistry.getState("slow").getStatus());
            assertEquals(SamTerminalLifecycleState.STOPPED, lifecycle.getState());
            assertTrue(serviceRegistry.getActionNames().isEmpty());
        }

        @Test
        @DisplayName("should refuse to start after stop")
        void shouldRefuseStartAfterStop() {
            // Given
            pluginRegistry.register(tracked("a"));
            lifecycle.stop().block();

            // When / Then
            StepVerifier.create(lifecycle.start())
                    .expectError(SamTerminalLifecycleStateException.class)
                    .verify();
            assertTrue(calls.isEmpty());
        }
    }

    @Nested
    @DisplayName("Listeners")
    class ListenerTests {

        @Test
        @DisplayName("should notify listeners and tolerate a failing one")
        void shouldNotifyListeners() {
            // Given
            List<String> events = new CopyOnWriteArrayList<>();
            lifecycle.addListener((event, plugin, error) -> {
                throw new IllegalStateException("listener bug");
            });
            lifecycle.addListener((event, plugin, error) -> events.add(event + ":" + plugin.getName()));
            pluginRegistry.register(tracked("a"));

            // When
            lifecycle.start().block();
            lifecycle.stop().block();

            // Then
            assertEquals(List.of(
                    SamTerminalLifecycleEvent.BEFORE_INIT + ":a",
                    SamTerminalLifecycleEvent.AFTER_INIT + ":a",
                    SamTerminalLifecycleEvent.BEFORE_DESTROY + ":a",
                    SamTerminalLifecycleEvent.AFTER_DESTROY + ":a"), events);
        }

        @Test
        @DisplayName("should report init failures to listeners with the error")
        void shouldReportErrors() {
            // Given
            List<Throwable> errors = new CopyOnWriteArrayList<>();
            lifecycle.addListener((event, plugin, error) -> {
                if (event == SamTerminalLifecycleEvent.ERROR) {
                    errors.add(error);
                }
            });
            pluginRegistry.register(trackedWith("a", Mono.error(new IllegalStateException("boom")), Mono.empty()));

            // When
            StepVerifier.create(lifecycle.start()).expectError().verify();

            // Then
            assertEquals(1, errors.size());
            assertEquals("boom", errors.get(0).getMessage());
        }
    }
}
