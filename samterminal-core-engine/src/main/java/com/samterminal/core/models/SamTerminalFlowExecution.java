package com.samterminal.core.models;

import com.samterminal.core.exception.action.SamTerminalActionExecutionException;
import com.samterminal.core.exception.flow.SamTerminalFlowNodeExecutionException;
import com.samterminal.integration.contract.ISamTerminalErrorInfo;
import com.samterminal.integration.enumerations.SamTerminalFlowExecutionStatus;
import com.samterminal.integration.enumerations.SamTerminalNodeExecutionStatus;
import com.samterminal.integration.models.flows.SamTerminalFlow;
import com.samterminal.integration.models.flows.SamTerminalFlowNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one run of a flow.
 *
 * <p>Created per execute call and never shared between runs. Nodes of one execution are visited
 * one at a time, so the maps are only guarded against publication across scheduler threads.</p>
 */
@Slf4j
@Getter
public class SamTerminalFlowExecution {
    private final String executionId;
    private final String flowId;
    private final Map<String, Object> variables;
    private final Map<String, SamTerminalNodeExecutionResult> nodeResults;
    private final Instant startedAt;
    private final AtomicInteger nodeVisits = new AtomicInteger();
    private volatile SamTerminalFlowExecutionStatus status;
    private volatile String currentNodeId;
    private volatile String error;
    private volatile Instant completedAt;

    public SamTerminalFlowExecution(String executionId, String flowId, Map<String, Object> initialVariables) {
        this.executionId = executionId;
        this.flowId = flowId;
        this.variables = Collections.synchronizedMap(new LinkedHashMap<>());
        if (initialVariables != null) {
            this.variables.putAll(initialVariables);
        }
        this.nodeResults = Collections.synchronizedMap(new LinkedHashMap<>());
        this.startedAt = Instant.now();
        this.status = SamTerminalFlowExecutionStatus.RUNNING;
    }

    public Object getVariable(String key) {
        return variables.get(key);
    }

    public void setVariable(String key, Object value) {
        variables.put(key, value);
    }

    /**
     * @return a copy of the variables safe to hand out to actions and conditions
     */
    public Map<String, Object> snapshotVariables() {
        synchronized (variables) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        }
    }

    public Optional<SamTerminalNodeExecutionResult> getNodeResult(String nodeId) {
        return Optional.ofNullable(nodeResults.get(nodeId));
    }

    public int incrementNodeVisits() {
        return nodeVisits.incrementAndGet();
    }

    public Long getDurationMs() {
        return completedAt == null ? null : Duration.between(startedAt, completedAt).toMillis();
    }

    public void captureFlowStart(SamTerminalFlow flow) {
        log.info("Starting flow: [{}], executionId: [{}]", flow.getId(), executionId);
    }

    public void captureFlowEnd() {
        this.status = SamTerminalFlowExecutionStatus.COMPLETED;
        this.completedAt = Instant.now();
        this.currentNodeId = null;
        log.info("Flow Completed: [{}], executionId: [{}], duration: [{}ms]", flowId, executionId, getDurationMs());
    }

    public void captureFlowEnd(Throwable throwable) {
        this.status = SamTerminalFlowExecutionStatus.FAILED;
        this.completedAt = Instant.now();
        this.error = throwable.getMessage();
        log.error("Flow Failed: [{}], executionId: [{}], Error: [{}]", flowId, executionId, throwable.getMessage());
    }

    public void captureNodeStart(SamTerminalFlowNode node) {
        this.currentNodeId = node.getId();
        nodeResults.put(node.getId(), new SamTerminalNodeExecutionResult(node.getId()));
        log.debug("Starting node: [{}], type: [{}], executionId: [{}]", node.getId(), node.getType(), executionId);
    }

    public void captureNodeEnd(SamTerminalFlowNode node, SamTerminalNodeOutput output) {
        SamTerminalNodeExecutionResult result = nodeResults.get(node.getId());
        result.setOutput(output.getData());
        result.setStatus(SamTerminalNodeExecutionStatus.COMPLETED);
        result.setCompletedAt(Instant.now());
        log.debug("Node Completed: [{}], branch: [{}], executionId: [{}]", node.getId(), output.getBranch(), executionId);
    }

    public void captureNodeEnd(SamTerminalFlowNode node, Throwable throwable) {
        SamTerminalNodeExecutionResult result = nodeResults.get(node.getId());
        result.setStatus(SamTerminalNodeExecutionStatus.FAILED);
        result.setError(errorMessageOf(throwable));
        result.setErrorCode(errorCodeOf(throwable));
        result.setCompletedAt(Instant.now());
        log.warn("Node Failed: [{}], executionId: [{}], Error: [{}]", node.getId(), executionId, result.getError());
    }

    public void captureNodeRecovered(SamTerminalFlowNode node) {
        SamTerminalNodeExecutionResult result = nodeResults.get(node.getId());
        result.setStatus(SamTerminalNodeExecutionStatus.COMPLETED);
        result.setRecovered(true);
        log.info("Node failure handled by recovery path: [{}], executionId: [{}]", node.getId(), executionId);
    }

    public static String errorMessageOf(Throwable throwable) {
        if (throwable instanceof SamTerminalActionExecutionException actionException) {
            return actionException.getReason();
        }
        return throwable.getMessage();
    }

    private static String errorCodeOf(Throwable throwable) {
        ISamTerminalErrorInfo errorInfo = null;
        if (throwable instanceof SamTerminalActionExecutionException actionException) {
            errorInfo = actionException.getErrorInfo();
        } else if (throwable instanceof SamTerminalFlowNodeExecutionException nodeException) {
            errorInfo = nodeException.getErrorInfo();
        }
        return errorInfo == null ? null : errorInfo.getErrorCode();
    }
}
