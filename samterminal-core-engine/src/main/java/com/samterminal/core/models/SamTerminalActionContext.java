package com.samterminal.core.models;

import com.samterminal.integration.contract.action.ISamTerminalActionContext;
import lombok.Data;

import java.util.Map;

@Data
public class SamTerminalActionContext implements ISamTerminalActionContext {
    private final String executionId;
    private final String pluginName;
    private final String actionName;
    private final Map<String, Object> params;
    private final Map<String, Object> variables;
}
