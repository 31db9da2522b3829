package com.samterminal.integration.models;

import com.samterminal.integration.contract.ISamTerminalPlugin;
import com.samterminal.integration.contract.ISamTerminalPluginContext;
import com.samterminal.integration.contract.action.ISamTerminalAction;
import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;
import com.samterminal.integration.models.actions.SamTerminalActionDefinitions;
import com.samterminal.integration.models.providers.SamTerminalProviderDefinitions;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

@Getter
@AllArgsConstructor
@ToString(of = {"name", "version", "dependencies"})
public class SamTerminalPlugin implements ISamTerminalPlugin {
    private final String name;
    private final String version;
    private final String description;
    private final List<String> dependencies;
    private final List<ISamTerminalAction> actions;
    private final List<ISamTerminalDataProvider> providers;
    private final Function<ISamTerminalPluginContext, Mono<Void>> initHook;
    private final Supplier<Mono<Void>> destroyHook;

    @Override
    public Mono<Void> init(ISamTerminalPluginContext context) {
        if (initHook == null) {
            return Mono.empty();
        }
        return Mono.defer(() -> initHook.apply(context));
    }

    @Override
    public Mono<Void> destroy() {
        if (destroyHook == null) {
            return Mono.empty();
        }
        return Mono.defer(destroyHook);
    }

    // ---------------------------------------------------------
    // Guided Builder
    // ---------------------------------------------------------

    public static InitialStepBuilder builder() { return new Builder(); }

    public interface InitialStepBuilder { VersionStep name(String name); }
    public interface VersionStep { DescriptionStep version(String version); }

    public interface DescriptionStep extends DependenciesStep {
        DependenciesStep description(String description);
    }

    public interface DependenciesStep extends ActionsStep {
        ActionsStep dependencies(String... dependencies);
    }

    public interface ActionsStep extends ProvidersStep {
        ProvidersStep actions(Function<SamTerminalActionDefinitions.InitialStepBuilder, SamTerminalActionDefinitions.BuildStep> builderFn);
    }

    public interface ProvidersStep extends InitStep {
        InitStep providers(Function<SamTerminalProviderDefinitions.InitialStepBuilder, SamTerminalProviderDefinitions.BuildStep> builderFn);
    }

    public interface InitStep extends DestroyStep {
        DestroyStep onInit(Function<ISamTerminalPluginContext, Mono<Void>> initHook);
    }

    public interface DestroyStep extends BuildStep {
        BuildStep onDestroy(Supplier<Mono<Void>> destroyHook);
    }

    public interface BuildStep { SamTerminalPlugin build(); }

    private static class Builder implements InitialStepBuilder, VersionStep, DescriptionStep, DependenciesStep, ActionsStep, ProvidersStep, InitStep, DestroyStep, BuildStep {
        private String name;
        private String version;
        private String description;
        private List<String> dependencies = List.of();
        private List<ISamTerminalAction> actions = List.of();
        private List<ISamTerminalDataProvider> providers = List.of();
        private Function<ISamTerminalPluginContext, Mono<Void>> initHook;
        private Supplier<Mono<Void>> destroyHook;

        @Override
        public VersionStep name(String name) {
            this.name = name;
            return this;
        }

        @Override
        public DescriptionStep version(String version) {
            this.version = version;
            return this;
        }

        @Override
        public DependenciesStep description(String description) {
            this.description = description;
            return this;
        }

        @Override
        public ActionsStep dependencies(String... dependencies) {
            this.dependencies = List.of(dependencies);
            return this;
        }

        @Override
        public ProvidersStep actions(Function<SamTerminalActionDefinitions.InitialStepBuilder, SamTerminalActionDefinitions.BuildStep> builderFn) {
            this.actions = builderFn.apply(SamTerminalActionDefinitions.builder()).build().getActions();
            return this;
        }

        @Override
        public InitStep providers(Function<SamTerminalProviderDefinitions.InitialStepBuilder, SamTerminalProviderDefinitions.BuildStep> builderFn) {
            this.providers = builderFn.apply(SamTerminalProviderDefinitions.builder()).build().getProviders();
            return this;
        }

        @Override
        public DestroyStep onInit(Function<ISamTerminalPluginContext, Mono<Void>> initHook) {
            this.initHook = initHook;
            return this;
        }

        @Override
        public BuildStep onDestroy(Supplier<Mono<Void>> destroyHook) {
            this.destroyHook = destroyHook;
            return this;
        }

        @Override
        public SamTerminalPlugin build() {
            return new SamTerminalPlugin(name, version, description, dependencies, actions, providers, initHook, destroyHook);
        }
    }
}
