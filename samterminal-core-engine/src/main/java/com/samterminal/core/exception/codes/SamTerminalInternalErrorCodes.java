package com.samterminal.core.exception.codes;

import com.samterminal.integration.contract.ISamTerminalErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum SamTerminalInternalErrorCodes implements ISamTerminalErrorInfo {

    ACTION_INPUT_TRANSFORMATION_FAILED(
            "SAMTERMINAL_ERR_0001",
            "Action params could not be converted into the action input type",
            "Check the params of the action node against the input type declared by the plugin"
    ),

    ACTION_INPUT_CONSTRAINT_VIOLATION_FAILED(
            "SAMTERMINAL_ERR_0002",
            "Action input violates the constraints of its input type",
            "Fix the params listed in the constraint violations"
    ),

    ACTION_INPUT_VALIDATION_PLUGIN_INTERNAL_ERROR(
            "SAMTERMINAL_ERR_0003",
            "Action input validator of the plugin failed unexpectedly",
            "Report the failure to the plugin maintainer"
    ),

    ACTION_INPUT_CONSTRAINT_VIOLATION_EXECUTION_FAILED(
            "SAMTERMINAL_ERR_0004",
            "Constraint validation of the action input could not be run",
            "Check the constraint annotations of the action input type"
    ),

    ACTION_EXECUTION_FAILED(
            "SAMTERMINAL_ERR_0005",
            "Action threw an error",
            "Inspect the root cause raised by the action"
    ),

    ACTION_REPORTED_FAILURE(
            "SAMTERMINAL_ERR_0006",
            "Action completed with success=false",
            "Inspect the error reported by the action"
    ),

    PROVIDER_EXECUTION_FAILED(
            "SAMTERMINAL_ERR_0007",
            "Data provider threw an error",
            "Inspect the root cause raised by the provider"
    ),

    FLOW_NODE_DATA_INVALID(
            "SAMTERMINAL_ERR_0008",
            "Flow node data is missing or does not match the node type",
            "Fix the node data in the flow definition"
    ),

    FLOW_NODE_VISIT_LIMIT_EXCEEDED(
            "SAMTERMINAL_ERR_0009",
            "Flow execution visited more nodes than allowed",
            "Break the cycle in the flow or raise maxNodeVisits"
    ),

    FLOW_LOOP_LIMIT_EXCEEDED(
            "SAMTERMINAL_ERR_0010",
            "Loop node produced more iterations than allowed",
            "Lower the loop count or raise maxLoopIterations"
    )

    ;

    private final String errorCode;
    private final String errorTemplate;
    private final String resolutionTemplate;
}
