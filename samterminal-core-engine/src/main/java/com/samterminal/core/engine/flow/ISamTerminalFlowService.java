package com.samterminal.core.engine.flow;

import com.samterminal.core.models.SamTerminalFlowExecution;
import com.samterminal.core.models.SamTerminalFlowValidationResult;
import com.samterminal.integration.models.flows.SamTerminalFlow;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory store of flow definitions.
 */
public interface ISamTerminalFlowService {

    /** Stores the flow, assigning an id when it has none and stamping creation time. */
    SamTerminalFlow create(SamTerminalFlow flow);

    /** Creates a flow holding only a manual trigger node. */
    SamTerminalFlow createEmpty(String name);

    SamTerminalFlow get(String flowId);
    Optional<SamTerminalFlow> find(String flowId);
    List<SamTerminalFlow> getAll();

    /** Case-insensitive match on name and description. */
    List<SamTerminalFlow> search(String query);

    SamTerminalFlow update(SamTerminalFlow flow);
    boolean delete(String flowId);
    SamTerminalFlow clone(String flowId);

    String exportJson(String flowId);
    SamTerminalFlow importJson(String json);

    SamTerminalFlowValidationResult validate(String flowId);
    Mono<SamTerminalFlowExecution> execute(String flowId, Map<String, Object> variables);
    Optional<SamTerminalFlowExecution> getExecution(String executionId);
}
