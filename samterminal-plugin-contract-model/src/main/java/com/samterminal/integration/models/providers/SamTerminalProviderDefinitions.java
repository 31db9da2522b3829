package com.samterminal.integration.models.providers;

import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

@Data
public class SamTerminalProviderDefinitions {
    private final List<ISamTerminalDataProvider> providers;

    public static InitialStepBuilder builder() { return new Builder(); }

    public interface InitialStepBuilder extends BuildStep {
        InitialStepBuilder provider(Function<SamTerminalProviderDefinition.InitialStepBuilder, SamTerminalProviderDefinition.BuildStep> fn);
        InitialStepBuilder provider(ISamTerminalDataProvider def);
    }
    public interface BuildStep { SamTerminalProviderDefinitions build(); }

    private static class Builder implements InitialStepBuilder, BuildStep {
        private final List<ISamTerminalDataProvider> list = new ArrayList<>();

        @Override
        public InitialStepBuilder provider(Function<SamTerminalProviderDefinition.InitialStepBuilder, SamTerminalProviderDefinition.BuildStep> fn) {
            list.add(fn.apply(SamTerminalProviderDefinition.builder()).build());
            return this;
        }

        @Override
        public InitialStepBuilder provider(ISamTerminalDataProvider def) {
            list.add(def);
            return this;
        }

        @Override
        public SamTerminalProviderDefinitions build() {
            return new SamTerminalProviderDefinitions(Collections.unmodifiableList(list));
        }
    }
}
