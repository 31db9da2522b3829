package com.samterminal.integration.contract.action;

import java.util.Map;

public interface ISamTerminalActionContext {
    /** Id of the flow execution invoking the action, or {@code null} for direct calls. */
    String getExecutionId();
    String getPluginName();
    String getActionName();
    Map<String, Object> getParams();

    /** Read-only view of the flow variables at the time of the call. */
    Map<String, Object> getVariables();
}
