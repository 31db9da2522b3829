package com.samterminal.core.engine;

import com.samterminal.core.engine.action.ISamTerminalActionExecutor;
import com.samterminal.core.engine.condition.ISamTerminalConditionEvaluator;
import com.samterminal.core.engine.flow.ISamTerminalFlowExecutor;
import com.samterminal.core.engine.flow.ISamTerminalFlowService;
import com.samterminal.core.engine.flow.ISamTerminalFlowValidator;
import com.samterminal.core.engine.plugin.ISamTerminalPluginLifecycle;
import com.samterminal.core.engine.plugin.ISamTerminalPluginLoader;
import com.samterminal.core.engine.plugin.ISamTerminalPluginRegistry;
import com.samterminal.core.engine.service.ISamTerminalServiceRegistry;
import com.samterminal.integration.contract.ISamTerminalObjectMapper;

/**
 * One wired engine instance. Instances share nothing, several may live in the same JVM.
 */
public interface ISamTerminalFacade {
    ISamTerminalPluginRegistry getPluginRegistry();
    ISamTerminalPluginLifecycle getPluginLifecycle();
    ISamTerminalPluginLoader getPluginLoader();
    ISamTerminalServiceRegistry getServiceRegistry();
    ISamTerminalActionExecutor getActionExecutor();
    ISamTerminalConditionEvaluator getConditionEvaluator();
    ISamTerminalFlowValidator getFlowValidator();
    ISamTerminalFlowExecutor getFlowExecutor();
    ISamTerminalFlowService getFlowService();
    ISamTerminalObjectMapper getObjectMapper();
}
