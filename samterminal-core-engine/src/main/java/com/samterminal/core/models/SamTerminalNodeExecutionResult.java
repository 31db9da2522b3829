package com.samterminal.core.models;

import com.samterminal.integration.enumerations.SamTerminalNodeExecutionStatus;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

@Data
public class SamTerminalNodeExecutionResult {
    private final String nodeId;
    private final Instant startedAt;
    private volatile SamTerminalNodeExecutionStatus status;
    private volatile Object output;
    private volatile String error;
    private volatile String errorCode;
    // true when the node failed and a failure edge handled it
    private volatile boolean recovered;
    private volatile Instant completedAt;

    public SamTerminalNodeExecutionResult(String nodeId) {
        this.nodeId = nodeId;
        this.startedAt = Instant.now();
        this.status = SamTerminalNodeExecutionStatus.RUNNING;
    }

    public Long getDurationMs() {
        return completedAt == null ? null : Duration.between(startedAt, completedAt).toMillis();
    }
}
