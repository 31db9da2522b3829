package com.samterminal.core.exception.flow;

import com.samterminal.integration.contract.ISamTerminalErrorInfo;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class SamTerminalFlowNodeExecutionException extends RuntimeException {
    private final String flowId;
    private final String nodeId;
    private final ISamTerminalErrorInfo errorInfo;

    public SamTerminalFlowNodeExecutionException(String flowId, String nodeId, ISamTerminalErrorInfo errorInfo, String detail) {
        super("Flow Node Execution Failed. " +
                "Flow: [" + flowId + "], " +
                "Node: [" + nodeId + "], " +
                "ErrorCode: [" + errorInfo.getErrorCode() + "], " +
                "Reason: [" + errorInfo.getErrorTemplate() + "], " +
                "Detail: [" + detail + "]");
        this.flowId = flowId;
        this.nodeId = nodeId;
        this.errorInfo = errorInfo;
    }
}
