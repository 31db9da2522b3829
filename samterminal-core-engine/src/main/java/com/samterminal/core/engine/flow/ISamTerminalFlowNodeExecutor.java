package com.samterminal.core.engine.flow;

import com.samterminal.core.models.SamTerminalFlowExecution;
import com.samterminal.core.models.SamTerminalNodeOutput;
import com.samterminal.integration.models.flows.SamTerminalFlow;
import com.samterminal.integration.models.flows.SamTerminalFlowNode;
import reactor.core.publisher.Mono;

public interface ISamTerminalFlowNodeExecutor {
    Mono<SamTerminalNodeOutput> execute(SamTerminalFlow flow, SamTerminalFlowNode node, SamTerminalFlowExecution execution);
}
