package com.samterminal.core.engine.flow.impl;

import com.samterminal.core.engine.action.ISamTerminalActionExecutor;
import com.samterminal.core.engine.condition.ISamTerminalConditionEvaluator;
import com.samterminal.core.engine.config.SamTerminalFlowEngineConfig;
import com.samterminal.core.engine.flow.ISamTerminalFlowNodeExecutor;
import com.samterminal.core.exception.codes.SamTerminalInternalErrorCodes;
import com.samterminal.core.exception.flow.SamTerminalFlowNodeExecutionException;
import com.samterminal.core.models.SamTerminalConditionEvaluationResult;
import com.samterminal.core.models.SamTerminalFlowExecution;
import com.samterminal.core.models.SamTerminalNodeOutput;
import com.samterminal.core.util.CommonUtil;
import com.samterminal.core.util.PathUtil;
import com.samterminal.integration.constant.SamTerminalConstants;
import com.samterminal.integration.enumerations.SamTerminalDelayType;
import com.samterminal.integration.enumerations.SamTerminalLoopType;
import com.samterminal.integration.models.conditions.SamTerminalCondition;
import com.samterminal.integration.models.conditions.SamTerminalConditionGroup;
import com.samterminal.integration.models.flows.SamTerminalFlow;
import com.samterminal.integration.models.flows.SamTerminalFlowNode;
import com.samterminal.integration.models.flows.data.SamTerminalActionNodeData;
import com.samterminal.integration.models.flows.data.SamTerminalConditionNodeData;
import com.samterminal.integration.models.flows.data.SamTerminalDelayNodeData;
import com.samterminal.integration.models.flows.data.SamTerminalFlowNodeData;
import com.samterminal.integration.models.flows.data.SamTerminalLoopNodeData;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Runs a single node. Which edges are followed afterwards is decided by the flow executor
 * from the returned branch.
 */
@Slf4j
public class SamTerminalFlowNodeExecutor implements ISamTerminalFlowNodeExecutor {

    private final ISamTerminalActionExecutor actionExecutor;
    private final ISamTerminalConditionEvaluator conditionEvaluator;
    private final SamTerminalFlowEngineConfig config;

    public SamTerminalFlowNodeExecutor(
            ISamTerminalActionExecutor actionExecutor,
            ISamTerminalConditionEvaluator conditionEvaluator,
            SamTerminalFlowEngineConfig config) {

        this.actionExecutor = actionExecutor;
        this.conditionEvaluator = conditionEvaluator;
        this.config = config;
    }

    @Override
    public Mono<SamTerminalNodeOutput> execute(SamTerminalFlow flow, SamTerminalFlowNode node, SamTerminalFlowExecution execution) {
        return Mono.defer(() -> {
            checkNodeData(flow, node);
            switch (node.getType()) {
                case TRIGGER:
                    return Mono.just(SamTerminalNodeOutput.ofEmpty());
                case ACTION:
                    return executeAction(flow, node, (SamTerminalActionNodeData) node.getData(), execution);
                case CONDITION:
                    return Mono.fromCallable(() -> executeCondition((SamTerminalConditionNodeData) node.getData(), execution));
                case LOOP:
                    return Mono.fromCallable(() -> executeLoop(flow, node, (SamTerminalLoopNodeData) node.getData(), execution));
                case DELAY:
                    return executeDelay(flow, node, (SamTerminalDelayNodeData) node.getData());
                case OUTPUT:
                    return Mono.fromCallable(() -> SamTerminalNodeOutput.ofData(execution.getVariable(SamTerminalConstants.LAST_OUTPUT_VARIABLE)));
                default:
                    return Mono.error(invalidData(flow, node, "unsupported node type: " + node.getType()));
            }
        });
    }

    private Mono<SamTerminalNodeOutput> executeAction(
            SamTerminalFlow flow,
            SamTerminalFlowNode node,
            SamTerminalActionNodeData data,
            SamTerminalFlowExecution execution) {

        if (CommonUtil.isNullOrBlank(data.getPluginName()) || CommonUtil.isNullOrBlank(data.getActionName())) {
            return Mono.error(invalidData(flow, node, "pluginName and actionName are required"));
        }

        Map<String, Object> variables = execution.snapshotVariables();
        Map<String, Object> params = SamTerminalFlowParamResolver.resolve(data.getParams(), variables);
        log.debug("Invoking action: [{}:{}], node: [{}], params: [{}]", data.getPluginName(), data.getActionName(), node.getId(), params);

        return actionExecutor.execute(data.getPluginName(), data.getActionName(), params, variables, execution.getExecutionId())
                .map(result -> {
                    execution.setVariable(SamTerminalConstants.LAST_OUTPUT_VARIABLE, result.getData());
                    return SamTerminalNodeOutput.ofData(result.getData());
                });
    }

    private SamTerminalNodeOutput executeCondition(SamTerminalConditionNodeData data, SamTerminalFlowExecution execution) {
        SamTerminalConditionEvaluationResult result;
        if (data.getOriginalConditionGroup() == null && data.getConditions().isEmpty()) {
            // a node without conditions always passes, whatever its operator
            result = new SamTerminalConditionEvaluationResult(true, List.of(), Instant.now());
        } else {
            SamTerminalCondition condition = Optional.<SamTerminalCondition>ofNullable(data.getOriginalConditionGroup())
                    .orElseGet(() -> new SamTerminalConditionGroup(data.getOperator(), data.getConditions()));
            result = conditionEvaluator.evaluate(condition, execution.snapshotVariables(), data.getTokenKey());
        }
        execution.setVariable(SamTerminalConstants.CONDITION_RESULT_VARIABLE, result.isMet());

        String branch = result.isMet() ? SamTerminalConstants.TRUE_HANDLE : SamTerminalConstants.FALSE_HANDLE;
        return SamTerminalNodeOutput.of(branch, result);
    }

    private SamTerminalNodeOutput executeLoop(
            SamTerminalFlow flow,
            SamTerminalFlowNode node,
            SamTerminalLoopNodeData data,
            SamTerminalFlowExecution execution) {

        List<Object> items;
        if (data.getLoopType() == SamTerminalLoopType.FOR_EACH) {
            items = forEachItems(data, execution);
            checkLoopLimit(flow, node, items.size());
        } else {
            if (data.getCount() == null || data.getCount() < 0) {
                throw invalidData(flow, node, "count must be zero or positive, was: " + data.getCount());
            }
            checkLoopLimit(flow, node, data.getCount());
            items = new ArrayList<>(IntStream.range(0, data.getCount()).boxed().toList());
        }

        execution.setVariable(SamTerminalConstants.LOOP_ITEMS_VARIABLE, items);
        return SamTerminalNodeOutput.ofData(items);
    }

    private List<Object> forEachItems(SamTerminalLoopNodeData data, SamTerminalFlowExecution execution) {
        if (CommonUtil.isNullOrBlank(data.getItems())) {
            return new ArrayList<>();
        }
        Object value = PathUtil.getValue(execution.snapshotVariables(), SamTerminalFlowParamResolver.pathOf(data.getItems()));
        if (value instanceof Collection<?> collection) {
            return new ArrayList<>(collection);
        }
        return new ArrayList<>();
    }

    private void checkLoopLimit(SamTerminalFlow flow, SamTerminalFlowNode node, int iterations) {
        if (iterations > config.getMaxLoopIterations()) {
            throw new SamTerminalFlowNodeExecutionException(
                    flow.getId(),
                    node.getId(),
                    SamTerminalInternalErrorCodes.FLOW_LOOP_LIMIT_EXCEEDED,
                    "iterations: " + iterations + ", limit: " + config.getMaxLoopIterations());
        }
    }

    private Mono<SamTerminalNodeOutput> executeDelay(SamTerminalFlow flow, SamTerminalFlowNode node, SamTerminalDelayNodeData data) {
        if (data.getDelayMs() < 0) {
            return Mono.error(invalidData(flow, node, "delayMs must not be negative, was: " + data.getDelayMs()));
        }

        long delayMs = data.getDelayMs();
        Long maxDelayMs = data.getMaxDelayMs();
        if (data.getDelayType() == SamTerminalDelayType.RANDOM && maxDelayMs != null && maxDelayMs > delayMs) {
            delayMs += (long) (config.getRandom().nextDouble() * (maxDelayMs - delayMs + 1));
        }

        long waitedMs = delayMs;
        log.debug("Delaying node: [{}], for: [{}ms]", node.getId(), waitedMs);
        return Mono.delay(Duration.ofMillis(waitedMs))
                .thenReturn(SamTerminalNodeOutput.ofData(Map.of("delayedMs", waitedMs)));
    }

    private void checkNodeData(SamTerminalFlow flow, SamTerminalFlowNode node) {
        if (node.getType() == null) {
            throw invalidData(flow, node, "node type is missing");
        }
        Class<? extends SamTerminalFlowNodeData> expected = SamTerminalFlowNodeData.dataTypeOf(node.getType());
        if (!expected.isInstance(node.getData())) {
            throw invalidData(flow, node, "expected data of type " + expected.getSimpleName());
        }
    }

    private static @NotNull SamTerminalFlowNodeExecutionException invalidData(SamTerminalFlow flow, SamTerminalFlowNode node, String detail) {
        return new SamTerminalFlowNodeExecutionException(flow.getId(), node.getId(), SamTerminalInternalErrorCodes.FLOW_NODE_DATA_INVALID, detail);
    }
}
