package com.samterminal.core.engine.flow;

import com.samterminal.core.models.SamTerminalFlowValidationResult;
import com.samterminal.integration.models.flows.SamTerminalFlow;

public interface ISamTerminalFlowValidator {
    /**
     * Structural check of a flow graph. Errors make the flow unexecutable, warnings
     * (self loops, cycles, unreachable nodes) do not.
     */
    SamTerminalFlowValidationResult validate(SamTerminalFlow flow);
}
