package com.samterminal.core.engine;

import com.samterminal.core.engine.action.ISamTerminalActionExecutor;
import com.samterminal.core.engine.action.impl.SamTerminalActionExecutor;
import com.samterminal.core.engine.condition.ISamTerminalConditionEvaluator;
import com.samterminal.core.engine.condition.impl.SamTerminalConditionEvaluator;
import com.samterminal.core.engine.config.SamTerminalConditionEvaluatorConfig;
import com.samterminal.core.engine.config.SamTerminalFlowEngineConfig;
import com.samterminal.core.engine.flow.ISamTerminalFlowExecutor;
import com.samterminal.core.engine.flow.ISamTerminalFlowService;
import com.samterminal.core.engine.flow.ISamTerminalFlowValidator;
import com.samterminal.core.engine.flow.impl.SamTerminalFlowExecutor;
import com.samterminal.core.engine.flow.impl.SamTerminalFlowNodeExecutor;
import com.samterminal.core.engine.flow.impl.SamTerminalFlowService;
import com.samterminal.core.engine.flow.impl.SamTerminalFlowValidator;
import com.samterminal.core.engine.misc.SamTerminalObjectMapper;
import com.samterminal.core.engine.plugin.ISamTerminalPluginLifecycle;
import com.samterminal.core.engine.plugin.ISamTerminalPluginLoader;
import com.samterminal.core.engine.plugin.ISamTerminalPluginRegistry;
import com.samterminal.core.engine.plugin.impl.SamTerminalPluginLifecycle;
import com.samterminal.core.engine.plugin.impl.SamTerminalPluginLoader;
import com.samterminal.core.engine.plugin.impl.SamTerminalPluginRegistry;
import com.samterminal.core.engine.service.ISamTerminalServiceRegistry;
import com.samterminal.core.engine.service.impl.SamTerminalServiceRegistry;
import com.samterminal.integration.contract.ISamTerminalObjectMapper;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Getter
public class SamTerminalFacade implements ISamTerminalFacade {

    private final ISamTerminalObjectMapper objectMapper;
    private final ISamTerminalPluginRegistry pluginRegistry;
    private final ISamTerminalServiceRegistry serviceRegistry;
    private final ISamTerminalPluginLifecycle pluginLifecycle;
    private final ISamTerminalPluginLoader pluginLoader;
    private final ISamTerminalActionExecutor actionExecutor;
    private final ISamTerminalConditionEvaluator conditionEvaluator;
    private final ISamTerminalFlowValidator flowValidator;
    private final ISamTerminalFlowExecutor flowExecutor;
    private final ISamTerminalFlowService flowService;

    @Builder
    private SamTerminalFacade(
            SamTerminalConditionEvaluatorConfig conditionEvaluatorConfig,
            SamTerminalFlowEngineConfig flowEngineConfig) {

        SamTerminalConditionEvaluatorConfig evaluatorConfig = conditionEvaluatorConfig == null
                ? SamTerminalConditionEvaluatorConfig.defaults()
                : conditionEvaluatorConfig;
        SamTerminalFlowEngineConfig engineConfig = flowEngineConfig == null
                ? SamTerminalFlowEngineConfig.defaults()
                : flowEngineConfig;

        this.objectMapper = new SamTerminalObjectMapper();
        this.pluginRegistry = new SamTerminalPluginRegistry();
        this.serviceRegistry = new SamTerminalServiceRegistry();
        this.pluginLifecycle = new SamTerminalPluginLifecycle(pluginRegistry, serviceRegistry, objectMapper);
        this.pluginLoader = new SamTerminalPluginLoader(pluginRegistry);
        this.actionExecutor = new SamTerminalActionExecutor(serviceRegistry, objectMapper);
        this.conditionEvaluator = new SamTerminalConditionEvaluator(evaluatorConfig);
        this.flowValidator = new SamTerminalFlowValidator();
        this.flowExecutor = new SamTerminalFlowExecutor(
                new SamTerminalFlowNodeExecutor(actionExecutor, conditionEvaluator, engineConfig),
                flowValidator,
                conditionEvaluator,
                engineConfig);
        this.flowService = new SamTerminalFlowService(flowExecutor, flowValidator, objectMapper);
        log.debug("Created engine, evaluator: [{}], flow engine: [{}]", evaluatorConfig, engineConfig);
    }

    public static SamTerminalFacade create() {
        return SamTerminalFacade.builder().build();
    }
}
