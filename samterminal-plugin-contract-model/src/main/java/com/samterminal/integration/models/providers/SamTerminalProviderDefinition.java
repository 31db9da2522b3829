package com.samterminal.integration.models.providers;

import com.samterminal.integration.contract.provider.ISamTerminalDataProvider;
import com.samterminal.integration.contract.provider.ISamTerminalProviderFunction;
import lombok.Data;

@Data
public class SamTerminalProviderDefinition implements ISamTerminalDataProvider {
    private final String name;
    private final String description;
    private final ISamTerminalProviderFunction providerFunction;

    public static InitialStepBuilder builder() { return new Builder(); }

    public interface InitialStepBuilder { DescriptionStep name(String name); }
    public interface DescriptionStep { GetStep description(String description); }
    public interface GetStep { BuildStep get(ISamTerminalProviderFunction providerFunction); }
    public interface BuildStep { SamTerminalProviderDefinition build(); }

    private static class Builder implements InitialStepBuilder, DescriptionStep, GetStep, BuildStep {
        private String name;
        private String description;
        private ISamTerminalProviderFunction providerFunction;

        @Override
        public DescriptionStep name(String name) { this.name = name; return this; }
        @Override
        public GetStep description(String description) { this.description = description; return this; }
        @Override
        public BuildStep get(ISamTerminalProviderFunction providerFunction) { this.providerFunction = providerFunction; return this; }
        @Override
        public SamTerminalProviderDefinition build() {
            return new SamTerminalProviderDefinition(name, description, providerFunction);
        }
    }
}
