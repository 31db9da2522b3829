package com.samterminal.core.engine.plugin.impl;

import com.samterminal.core.exception.plugin.SamTerminalInvalidPlugin;
import com.samterminal.core.exception.plugin.SamTerminalPluginAlreadyRegistered;
import com.samterminal.core.exception.plugin.SamTerminalPluginCircularDependency;
import com.samterminal.core.exception.plugin.SamTerminalPluginDependencyMissing;
import com.samterminal.core.exception.plugin.SamTerminalPluginInUse;
import com.samterminal.core.exception.plugin.SamTerminalPluginNotFound;
import com.samterminal.core.models.SamTerminalPluginRegistrationOptions;
import com.samterminal.integration.contract.ISamTerminalPlugin;
import com.samterminal.integration.enumerations.SamTerminalPluginStatus;
import com.samterminal.integration.models.SamTerminalPlugin;
import com.samterminal.integration.models.actions.SamTerminalActionOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class SamTerminalPluginRegistryTest {

    private SamTerminalPluginRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SamTerminalPluginRegistry();
    }

    private static ISamTerminalPlugin plugin(String name, String... dependencies) {
        return SamTerminalPlugin.builder()
                .name(name)
                .version("1.0.0")
                .dependencies(dependencies)
                .build();
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("should register a plugin without running it")
        void shouldRegisterPlugin() {
            // When
            registry.register(plugin("wallet"));

            // Then
            assertTrue(registry.has("wallet"));
            assertEquals(1, registry.size());
            assertEquals("wallet", registry.get("wallet").getName());
            assertEquals(SamTerminalPluginStatus.REGISTERED, registry.getState("wallet").getStatus());
            assertNull(registry.getState("wallet").getInitializedAt());
        }

        @Test
        @DisplayName("should reject a second plugin with the same name and keep the first")
        void shouldRejectDuplicateName() {
            // Given
            registry.register(plugin("wallet"));
            ISamTerminalPlugin newer = SamTerminalPlugin.builder().name("wallet").version("2.0.0").build();

            // When
            SamTerminalPluginAlreadyRegistered error = assertThrows(SamTerminalPluginAlreadyRegistered.class, () -> registry.register(newer));

            // Then
            assertEquals("1.0.0", error.getExistingVersion());
            assertEquals("2.0.0", error.getNewVersion());
            assertEquals("1.0.0", registry.get("wallet").getVersion());
        }

        @Test
        @DisplayName("should accept a plugin whose dependency is registered later")
        void shouldAcceptLateDependency() {
            registry.register(plugin("swap", "wallet"));

            assertEquals(List.of("wallet"), registry.getMissingDependencies("swap"));
            assertEquals(Map.of("swap", List.of("wallet")), registry.getMissingDependencies());

            registry.register(plugin("wallet"));

            assertTrue(registry.getMissingDependencies().isEmpty());
        }

        @Test
        @DisplayName("should report every structural problem of an invalid plugin")
        void shouldRejectInvalidPlugin() {
            // Given
            ISamTerminalPlugin invalid = SamTerminalPlugin.builder()
                    .name("broken")
                    .version(" ")
                    .actions(actions -> actions
                            .action(action -> action
                                    .name("quote")
                                    .description("first")
                                    .execute((input, context) -> Mono.just(SamTerminalActionOutput.ofEmpty())))
                            .action(action -> action
                                    .name("quote")
                                    .description("second")
                                    .execute(null)))
                    .build();

            // When
            SamTerminalInvalidPlugin error = assertThrows(SamTerminalInvalidPlugin.class, () -> registry.register(invalid));

            // Then
            assertEquals("broken", error.getPluginName());
            assertTrue(error.getProblems().contains("version is required"));
            assertTrue(error.getProblems().contains("duplicate action: quote"));
            assertTrue(error.getProblems().contains("action without function: quote"));
            assertFalse(registry.has("broken"));
        }

        @Test
        @DisplayName("should reject a null plugin")
        void shouldRejectNullPlugin() {
            assertThrows(SamTerminalInvalidPlugin.class, () -> registry.register(null));
        }

        @Test
        @DisplayName("should throw when looking up an unknown plugin")
        void shouldThrowForUnknownPlugin() {
            assertThrows(SamTerminalPluginNotFound.class, () -> registry.get("nope"));
            assertThrows(SamTerminalPluginNotFound.class, () -> registry.getState("nope"));
            assertFalse(registry.has("nope"));
        }
    }

    @Nested
    @DisplayName("Unregistration")
    class UnregistrationTests {

        @Test
        @DisplayName("should refuse to remove a plugin others depend on")
        void shouldRefuseWhileInUse() {
            // Given
            registry.register(plugin("wallet"));
            registry.register(plugin("swap", "wallet"));
            registry.register(plugin("bridge", "wallet"));

            // When
            SamTerminalPluginInUse error = assertThrows(SamTerminalPluginInUse.class, () -> registry.unregister("wallet"));

            // Then
            assertEquals(List.of("bridge", "swap"), error.getDependents());
            assertTrue(registry.has("wallet"));
        }

        @Test
        @DisplayName("should remove a plugin once its dependents are gone")
        void shouldUnregisterAfterDependents() {
            registry.register(plugin("wallet"));
            registry.register(plugin("swap", "wallet"));

            registry.unregister("swap");
            registry.unregister("wallet");

            assertEquals(0, registry.size());
            assertEquals(Set.of(), registry.getNames());
        }

        @Test
        @DisplayName("should throw when removing an unknown plugin")
        void shouldThrowForUnknownPlugin() {
            assertThrows(SamTerminalPluginNotFound.class, () -> registry.unregister("nope"));
        }
    }

    @Nested
    @DisplayName("Load order")
    class LoadOrderTests {

        @Test
        @DisplayName("should order a diamond with dependencies first")
        void shouldOrderDiamond() {
            // Given
            registry.register(plugin("d", "b", "c"));
            registry.register(plugin("c", "a"));
            registry.register(plugin("b", "a"));
            registry.register(plugin("a"));

            // When
            List<String> order = registry.getLoadOrder();

            // Then
            assertEquals(List.of("a", "b", "c", "d"), order);
        }

        @Test
        @DisplayName("should prefer higher priority among independent plugins")
        void shouldBreakTiesByPriority() {
            registry.register(plugin("alpha"));
            registry.register(plugin("beta"), SamTerminalPluginRegistrationOptions.builder().priority(10).build());
            registry.register(plugin("gamma", "alpha"));

            List<String> order = registry.getLoadOrder();

            assertEquals(List.of("beta", "alpha", "gamma"), order);
        }

        @Test
        @DisplayName("should report the cycle when dependencies are circular")
        void shouldDetectCycle() {
            // Given
            registry.register(plugin("a", "c"));
            registry.register(plugin("b", "a"));
            registry.register(plugin("c", "b"));

            // When
            SamTerminalPluginCircularDependency error = assertThrows(SamTerminalPluginCircularDependency.class, () -> registry.getLoadOrder());

            // Then
            List<String> cycle = error.getCycle();
            assertEquals(4, cycle.size());
            assertEquals(cycle.get(0), cycle.get(cycle.size() - 1));
            assertTrue(cycle.containsAll(List.of("a", "b", "c")));
        }

        @Test
        @DisplayName("should fail with every missing dependency before ordering")
        void shouldFailOnMissingDependency() {
            registry.register(plugin("swap", "wallet", "prices"));
            registry.register(plugin("bridge"));

            SamTerminalPluginDependencyMissing error = assertThrows(SamTerminalPluginDependencyMissing.class, () -> registry.getLoadOrder());

            assertEquals(Map.of("swap", List.of("wallet", "prices")), error.getMissingDependencies());
        }

        @Test
        @DisplayName("should compute a consistent order while plugins with unmet dependencies come and go")
        void shouldOrderConsistentlyUnderConcurrentRegistration() throws InterruptedException {
            // Given
            registry.register(plugin("core"));
            registry.register(plugin("wallet", "core"));
            AtomicBoolean running = new AtomicBoolean(true);
            Thread churn = new Thread(() -> {
                while (running.get()) {
                    registry.register(plugin("late", "absent"));
                    registry.unregister("late");
                }
            });
            churn.start();

            // When / Then
            try {
                for (int i = 0; i < 5_000; i++) {
                    try {
                        assertEquals(List.of("core", "wallet"), registry.getLoadOrder());
                    } catch (SamTerminalPluginDependencyMissing e) {
                        assertEquals(Map.of("late", List.of("absent")), e.getMissingDependencies());
                    }
                }
            } finally {
                running.set(false);
                churn.join(5_000);
            }
            assertFalse(churn.isAlive());
        }

        @Test
        @DisplayName("should return an empty order for an empty registry")
        void shouldHandleEmptyRegistry() {
            assertTrue(registry.getLoadOrder().isEmpty());
        }
    }
}
