package com.samterminal.integration.models.actions;

import com.samterminal.integration.contract.action.ISamTerminalAction;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

@Data
public class SamTerminalActionDefinitions {
    private final List<ISamTerminalAction> actions;

    public static InitialStepBuilder builder() { return new Builder(); }

    public interface InitialStepBuilder extends BuildStep {
        InitialStepBuilder action(Function<SamTerminalActionDefinition.InitialStepBuilder, SamTerminalActionDefinition.BuildStep> fn);
        InitialStepBuilder action(ISamTerminalAction def);
    }
    public interface BuildStep { SamTerminalActionDefinitions build(); }

    private static class Builder implements InitialStepBuilder, BuildStep {
        private final List<ISamTerminalAction> list = new ArrayList<>();

        @Override
        public InitialStepBuilder action(Function<SamTerminalActionDefinition.InitialStepBuilder, SamTerminalActionDefinition.BuildStep> fn) {
            list.add(fn.apply(SamTerminalActionDefinition.builder()).build());
            return this;
        }

        @Override
        public InitialStepBuilder action(ISamTerminalAction def) {
            list.add(def);
            return this;
        }

        @Override
        public SamTerminalActionDefinitions build() {
            return new SamTerminalActionDefinitions(Collections.unmodifiableList(list));
        }
    }
}
