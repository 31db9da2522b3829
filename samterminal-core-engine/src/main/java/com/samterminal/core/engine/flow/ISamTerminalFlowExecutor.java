package com.samterminal.core.engine.flow;

import com.samterminal.core.models.SamTerminalFlowExecution;
import com.samterminal.integration.models.flows.SamTerminalFlow;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ISamTerminalFlowExecutor {

    /**
     * Walks the flow from its trigger node. Emits the completed execution, including runs whose
     * failures were routed over failure edges. An unrecovered node failure is emitted as the
     * error raised by that node and leaves the execution {@code failed}.
     */
    Mono<SamTerminalFlowExecution> execute(SamTerminalFlow flow, Map<String, Object> initialVariables);

    Optional<SamTerminalFlowExecution> getExecution(String executionId);

    /** Retained executions of a flow, oldest first. */
    List<SamTerminalFlowExecution> getExecutions(String flowId);
}
