package com.samterminal.core.engine.flow.impl;

import com.samterminal.core.engine.condition.ISamTerminalConditionEvaluator;
import com.samterminal.core.engine.config.SamTerminalFlowEngineConfig;
import com.samterminal.core.engine.flow.ISamTerminalFlowExecutor;
import com.samterminal.core.engine.flow.ISamTerminalFlowNodeExecutor;
import com.samterminal.core.engine.flow.ISamTerminalFlowValidator;
import com.samterminal.core.exception.codes.SamTerminalInternalErrorCodes;
import com.samterminal.core.exception.flow.SamTerminalFlowNodeExecutionException;
import com.samterminal.core.exception.flow.SamTerminalFlowValidationException;
import com.samterminal.core.models.SamTerminalFlowExecution;
import com.samterminal.core.models.SamTerminalFlowValidationResult;
import com.samterminal.core.models.SamTerminalNodeOutput;
import com.samterminal.integration.constant.SamTerminalConstants;
import com.samterminal.integration.enumerations.SamTerminalFlowEdgeType;
import com.samterminal.integration.enumerations.SamTerminalFlowNodeType;
import com.samterminal.integration.models.flows.SamTerminalFlow;
import com.samterminal.integration.models.flows.SamTerminalFlowEdge;
import com.samterminal.integration.models.flows.SamTerminalFlowNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
public class SamTerminalFlowExecutor implements ISamTerminalFlowExecutor {

    private final ISamTerminalFlowNodeExecutor nodeExecutor;
    private final ISamTerminalFlowValidator flowValidator;
    private final ISamTerminalConditionEvaluator conditionEvaluator;
    private final SamTerminalFlowEngineConfig config;
    private final Map<String, SamTerminalFlowExecution> executions;

    public SamTerminalFlowExecutor(
            ISamTerminalFlowNodeExecutor nodeExecutor,
            ISamTerminalFlowValidator flowValidator,
            ISamTerminalConditionEvaluator conditionEvaluator,
            SamTerminalFlowEngineConfig config) {

        this.nodeExecutor = nodeExecutor;
        this.flowValidator = flowValidator;
        this.conditionEvaluator = conditionEvaluator;
        this.config = config;
        this.executions = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SamTerminalFlowExecution> eldest) {
                return size() > config.getMaxRetainedExecutions();
            }
        };
    }

    @Override
    public Mono<SamTerminalFlowExecution> execute(SamTerminalFlow flow, Map<String, Object> initialVariables) {
        return Mono.fromCallable(() -> prepareExecution(flow, initialVariables))
                .flatMap(execution -> Mono.just(execution)
                        .doOnNext(e -> doPreStartActions(flow, e))
                        .flatMap(e -> executeNode(flow, findTrigger(flow), e))
                        .then(Mono.fromCallable(() -> execution))
                        .doOnNext(this::doPostEndActions)
                        .doOnError(throwable -> doPostEndActions(execution, throwable)));
    }

    private SamTerminalFlowExecution prepareExecution(SamTerminalFlow flow, Map<String, Object> initialVariables) {
        if (config.isValidateBeforeExecute()) {
            SamTerminalFlowValidationResult validationResult = flowValidator.validate(flow);
            if (!validationResult.isValid()) {
                throw new SamTerminalFlowValidationException(flow.getId(), validationResult.getErrors());
            }
        }
        // fail before an execution is recorded
        findTrigger(flow);

        SamTerminalFlowExecution execution = new SamTerminalFlowExecution(UUID.randomUUID().toString(), flow.getId(), initialVariables);
        synchronized (executions) {
            executions.put(execution.getExecutionId(), execution);
        }
        return execution;
    }

    private SamTerminalFlowNode findTrigger(SamTerminalFlow flow) {
        return flow.findNodes(SamTerminalFlowNodeType.TRIGGER).stream()
                .findFirst()
                .orElseThrow(() -> new SamTerminalFlowValidationException(flow.getId(), List.of("flow has no trigger node")));
    }

    private void doPreStartActions(SamTerminalFlow flow, SamTerminalFlowExecution execution) {
        execution.captureFlowStart(flow);
    }

    // recursive method
    private Mono<Void> executeNode(SamTerminalFlow flow, SamTerminalFlowNode node, SamTerminalFlowExecution execution) {
        int visits = execution.incrementNodeVisits();
        if (visits > config.getMaxNodeVisits()) {
            return Mono.error(new SamTerminalFlowNodeExecutionException(
                    flow.getId(),
                    node.getId(),
                    SamTerminalInternalErrorCodes.FLOW_NODE_VISIT_LIMIT_EXCEEDED,
                    "visits: " + visits + ", limit: " + config.getMaxNodeVisits()));
        }

        return Mono.just(node)
                .doOnNext(execution::captureNodeStart)
                .flatMap(n -> nodeExecutor.execute(flow, n, execution))
                .switchIfEmpty(Mono.fromSupplier(SamTerminalNodeOutput::ofEmpty))
                .doOnNext(output -> execution.captureNodeEnd(node, output))
                .doOnError(throwable -> execution.captureNodeEnd(node, throwable))

                // only failures of this node are routed, errors of downstream nodes pass through
                .onErrorResume(throwable -> recover(flow, node, throwable, execution).then(Mono.<SamTerminalNodeOutput>empty()))
                .flatMap(output -> followEdges(flow, node, output, execution));
    }

    private Mono<Void> recover(SamTerminalFlow flow, SamTerminalFlowNode node, Throwable throwable, SamTerminalFlowExecution execution) {
        List<SamTerminalFlowEdge> failureEdges = flow.outgoingEdges(node.getId()).stream()
                .filter(SamTerminalFlowEdge::isFailureEdge)
                .toList();
        if (failureEdges.isEmpty()) {
            return Mono.error(throwable);
        }

        Map<String, Object> error = new LinkedHashMap<>();
        error.put(SamTerminalConstants.ERROR_MESSAGE_KEY, SamTerminalFlowExecution.errorMessageOf(throwable));
        error.put(SamTerminalConstants.ERROR_NODE_ID_KEY, node.getId());
        error.put(SamTerminalConstants.ERROR_NODE_NAME_KEY, node.displayName());
        execution.setVariable(SamTerminalConstants.ERROR_VARIABLE, error);
        log.info("Routing failure of node: [{}] over failure edges: {}", node.getId(), failureEdges.stream().map(SamTerminalFlowEdge::getTarget).toList());

        return Flux.fromIterable(failureEdges)
                .concatMap(edge -> executeNode(flow, targetOf(flow, edge), execution))
                .then(Mono.fromRunnable(() -> execution.captureNodeRecovered(node)));
    }

    private Mono<Void> followEdges(
            SamTerminalFlow flow,
            SamTerminalFlowNode node,
            SamTerminalNodeOutput output,
            SamTerminalFlowExecution execution) {

        List<SamTerminalFlowEdge> edges = new ArrayList<>();
        for (SamTerminalFlowEdge edge : flow.outgoingEdges(node.getId())) {
            if (edge.isFailureEdge()) {
                continue;
            }
            if (output.getBranch() == null || output.getBranch().equals(edge.getSourceHandle())) {
                edges.add(edge);
            }
        }
        if (edges.isEmpty()) {
            log.debug("No edge to follow from node: [{}], branch: [{}], executionId: [{}]", node.getId(), output.getBranch(), execution.getExecutionId());
            return Mono.empty();
        }

        // evaluated when reached, so earlier siblings may change the variables it sees
        return Flux.fromIterable(edges)
                .concatMap(edge -> Mono.defer(() -> isEdgeConditionMet(edge, execution)
                        ? executeNode(flow, targetOf(flow, edge), execution)
                        : Mono.empty()))
                .then();
    }

    private boolean isEdgeConditionMet(SamTerminalFlowEdge edge, SamTerminalFlowExecution execution) {
        if (edge.getType() != SamTerminalFlowEdgeType.CONDITIONAL || edge.getCondition() == null) {
            return true;
        }
        boolean met = conditionEvaluator.evaluate(edge.getCondition(), execution.snapshotVariables()).isMet();
        log.debug("Conditional edge: [{}], met: [{}]", edge.getId(), met);
        return met;
    }

    private SamTerminalFlowNode targetOf(SamTerminalFlow flow, SamTerminalFlowEdge edge) {
        return flow.findNode(edge.getTarget())
                .orElseThrow(() -> new SamTerminalFlowValidationException(
                        flow.getId(),
                        List.of("edge " + edge.getId() + " targets unknown node " + edge.getTarget())));
    }

    private void doPostEndActions(SamTerminalFlowExecution execution) {
        execution.captureFlowEnd();
    }

    private void doPostEndActions(SamTerminalFlowExecution execution, Throwable throwable) {
        execution.captureFlowEnd(throwable);
    }

    @Override
    public Optional<SamTerminalFlowExecution> getExecution(String executionId) {
        synchronized (executions) {
            return Optional.ofNullable(executions.get(executionId));
        }
    }

    @Override
    public List<SamTerminalFlowExecution> getExecutions(String flowId) {
        synchronized (executions) {
            return executions.values().stream()
                    .filter(execution -> execution.getFlowId() != null && execution.getFlowId().equals(flowId))
                    .toList();
        }
    }
}
