package com.samterminal.core.engine.flow.impl;

import com.samterminal.core.engine.SamTerminalFacade;
import com.samterminal.core.engine.config.SamTerminalFlowEngineConfig;
import com.samterminal.core.exception.action.SamTerminalActionExecutionException;
import com.samterminal.core.exception.action.SamTerminalActionNotFound;
import com.samterminal.core.exception.codes.SamTerminalInternalErrorCodes;
import com.samterminal.core.exception.flow.SamTerminalFlowNodeExecutionException;
import com.samterminal.core.exception.flow.SamTerminalFlowValidationException;
import com.samterminal.core.models.SamTerminalFlowExecution;
import com.samterminal.core.models.SamTerminalNodeExecutionResult;
import com.samterminal.integration.constant.SamTerminalConstants;
import com.samterminal.integration.enumerations.SamTerminalDelayType;
import com.samterminal.integration.enumerations.SamTerminalFlowExecutionStatus;
import com.samterminal.integration.enumerations.SamTerminalLogicalOperator;
import com.samterminal.integration.enumerations.SamTerminalLoopType;
import com.samterminal.integration.enumerations.SamTerminalNodeExecutionStatus;
import com.samterminal.integration.models.SamTerminalPlugin;
import com.samterminal.integration.models.actions.SamTerminalActionOutput;
import com.samterminal.integration.models.conditions.SamTerminalConditionGroup;
import com.samterminal.integration.models.flows.SamTerminalFlow;
import com.samterminal.integration.models.flows.SamTerminalFlowEdge;
import com.samterminal.integration.models.flows.SamTerminalFlowNode;
import com.samterminal.integration.models.flows.data.SamTerminalActionNodeData;
import com.samterminal.integration.models.flows.data.SamTerminalConditionNodeData;
import com.samterminal.integration.models.flows.data.SamTerminalDelayNodeData;
import com.samterminal.integration.models.flows.data.SamTerminalLoopNodeData;
import com.samterminal.integration.models.flows.data.SamTerminalOutputNodeData;
import com.samterminal.integration.models.flows.data.SamTerminalTriggerNodeData;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.samterminal.integration.models.conditions.SamTerminalConditions.gt;
import static com.samterminal.integration.models.conditions.SamTerminalConditions.lte;
import static com.samterminal.integration.models.conditions.SamTerminalConditions.or;
import static org.junit.jupiter.api.Assertions.*;

@Slf4j
class SamTerminalFlowExecutorTest {

    private SamTerminalFacade facade;

    @BeforeEach
    void setUp() {
        facade = engineWith(SamTerminalFlowEngineConfig.defaults());
    }

    private static SamTerminalFacade engineWith(SamTerminalFlowEngineConfig config) {
        SamTerminalFacade engine = SamTerminalFacade.builder().flowEngineConfig(config).build();
        engine.getPluginRegistry().register(SamTerminalPlugin.builder()
                .name("test")
                .version("1.0.0")
                .actions(actions -> actions
                        .action(action -> action
                                .name("echo")
                                .description("returns its params")
                                .execute((input, context) -> Mono.just(SamTerminalActionOutput.ofData(new LinkedHashMap<>(context.getParams())))))
                        .action(action -> action
                                .name("boom")
                                .description("always throws")
                                .execute((input, context) -> Mono.error(new IllegalStateException("exploded"))))
                        .action(action -> action
                                .name("reportFailure")
                                .description("reports success=false")
                                .execute((input, context) -> Mono.just(SamTerminalActionOutput.ofFailure("insufficient funds"))))
                        .action(action -> action
                                .name("handle")
                                .description("captures the routed error")
                                .execute((input, context) -> Mono.just(SamTerminalActionOutput.ofData(
                                        Map.of("handled", context.getVariables().get(SamTerminalConstants.ERROR_VARIABLE)))))))
                .build());
        engine.getPluginLifecycle().start().block();
        return engine;
    }

    private static SamTerminalFlowNode trigger() {
        return SamTerminalFlowNode.of("trigger", "Trigger", SamTerminalTriggerNodeData.builder().build());
    }

    private static SamTerminalFlowNode action(String id, String actionName, Map<String, Object> params) {
        return SamTerminalFlowNode.of(id, id, SamTerminalActionNodeData.builder()
                .pluginName("test")
                .actionName(actionName)
                .params(params)
                .build());
    }

    private static SamTerminalFlowNode output() {
        return SamTerminalFlowNode.of("output", "Output", SamTerminalOutputNodeData.builder().build());
    }

    private static SamTerminalFlow flow(List<SamTerminalFlowNode> nodes, List<SamTerminalFlowEdge> edges) {
        return SamTerminalFlow.builder()
                .id("flow-1")
                .name("test flow")
                .nodes(nodes)
                .edges(edges)
                .build();
    }

    private static Object outputOf(SamTerminalFlowExecution execution, String nodeId) {
        return execution.getNodeResult(nodeId).map(SamTerminalNodeExecutionResult::getOutput).orElse(null);
    }

    @Nested
    @DisplayName("Linear flows")
    class LinearTests {

        @Test
        @DisplayName("should run trigger, action and output in order")
        void shouldRunLinearFlow() {
            // Given
            SamTerminalFlow flow = flow(
                    List.of(trigger(), action("quote", "echo", Map.of("symbol", "ETH", "price", 75)), output()),
                    List.of(SamTerminalFlowEdge.of("trigger", "quote"), SamTerminalFlowEdge.of("quote", "output")));

            // When / Then
            StepVerifier.create(facade.getFlowExecutor().execute(flow, Map.of()))
                    .assertNext(execution -> {
                        assertEquals(SamTerminalFlowExecutionStatus.COMPLETED, execution.getStatus());
                        assertEquals(Map.of("symbol", "ETH", "price", 75), outputOf(execution, "output"));
                        assertEquals(Map.of("symbol", "ETH", "price", 75), execution.getVariable(SamTerminalConstants.LAST_OUTPUT_VARIABLE));
                        assertEquals(List.of("trigger", "quote", "output"), List.copyOf(execution.getNodeResults().keySet()));
                        assertNotNull(execution.getCompletedAt());
                        assertNull(execution.getError());
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should resolve whole string templates against the variables")
        void shouldResolveTemplates() {
            // Given
            Map<String, Object> params = Map.of(
                    "amount", "{{order.amount}}",
                    "note", "pay {{order.amount}}",
                    "nested", Map.of("symbol", "{{symbol}}"),
                    "missing", "{{nope}}");
            SamTerminalFlow flow = flow(
                    List.of(trigger(), action("pay", "echo", params)),
                    List.of(SamTerminalFlowEdge.of("trigger", "pay")));
            Map<String, Object> variables = Map.of("order", Map.of("amount", 1.5), "symbol", "ETH");

            // When
            SamTerminalFlowExecution execution = facade.getFlowExecutor().execute(flow, variables).block();

            // Then
            assertNotNull(execution);
            @SuppressWarnings("unchecked")
            Map<String, Object> resolved = (Map<String, Object>) outputOf(execution, "pay");
            assertEquals(1.5, resolved.get("amount"));
            assertEquals("pay {{order.amount}}", resolved.get("note"));
            assertEquals(Map.of("symbol", "ETH"), resolved.get("nested"));
            assertTrue(resolved.containsKey("missing"));
            assertNull(resolved.get("missing"));
        }

        @Test
        @DisplayName("should keep executions of the same flow independent")
        void shouldIsolateExecutions() {
            // Given
            SamTerminalFlow flow = flow(
                    List.of(trigger(), action("quote", "echo", Map.of("price", "{{price}}"))),
                    List.of(SamTerminalFlowEdge.of("trigger", "quote")));

            // When
            SamTerminalFlowExecution first = facade.getFlowExecutor().execute(flow, Map.of("price", 75)).block();
            SamTerminalFlowExecution second = facade.getFlowExecutor().execute(flow, Map.of("price", 25)).block();

            // Then
            assertNotNull(first);
            assertNotNull(second);
            assertNotEquals(first.getExecutionId(), second.getExecutionId());
            assertEquals(Map.of("price", 75), outputOf(first, "quote"));
            assertEquals(Map.of("price", 25), outputOf(second, "quote"));
            assertEquals(2, facade.getFlowExecutor().getExecutions("flow-1").size());
            assertSame(first, facade.getFlowExecutor().getExecution(first.getExecutionId()).orElseThrow());
        }
    }

    @Nested
    @DisplayName("Branching")
    class BranchingTests {

        private SamTerminalFlow priceFlow(SamTerminalConditionNodeData conditionData) {
            return flow(
                    List.of(
                            trigger(),
                            action("quote", "echo", Map.of("price", "{{price}}")),
                            SamTerminalFlowNode.of("check", "Price check", conditionData),
                            action("high", "echo", Map.of("branch", "high")),
                            action("low", "echo", Map.of("branch", "low"))),
                    List.of(
                            SamTerminalFlowEdge.of("trigger", "quote"),
                            SamTerminalFlowEdge.of("quote", "check"),
                            SamTerminalFlowEdge.ofTrue("check", "high"),
                            SamTerminalFlowEdge.ofFalse("check", "low")));
        }

        @Test
        @DisplayName("should follow only the branch matching the condition result")
        void shouldFollowConditionBranch() {
            // Given
            SamTerminalFlow flow = priceFlow(SamTerminalConditionNodeData.builder()
                    .conditions(List.of(gt("_lastOutput.price", 50)))
                    .build());

            // When
            SamTerminalFlowExecution high = facade.getFlowExecutor().execute(flow, Map.of("price", 75)).block();
            SamTerminalFlowExecution low = facade.getFlowExecutor().execute(flow, Map.of("price", 25)).block();

            // Then
            assertNotNull(high);
            assertTrue(high.getNodeResult("high").isPresent());
            assertFalse(high.getNodeResult("low").isPresent());
            assertEquals(true, high.getVariable(SamTerminalConstants.CONDITION_RESULT_VARIABLE));

            assertNotNull(low);
            assertTrue(low.getNodeResult("low").isPresent());
            assertFalse(low.getNodeResult("high").isPresent());
            assertEquals(false, low.getVariable(SamTerminalConstants.CONDITION_RESULT_VARIABLE));
        }

        @Test
        @DisplayName("should prefer the original condition tree over the flattened conditions")
        void shouldPreferOriginalConditionGroup() {
            // Given
            SamTerminalConditionGroup original = or(gt("_lastOutput.price", 50), gt("_lastOutput.price", 1000));
            SamTerminalFlow flow = priceFlow(SamTerminalConditionNodeData.builder()
                    .conditions(List.of(gt("_lastOutput.price", 1000)))
                    .operator(SamTerminalLogicalOperator.AND)
                    .originalConditionGroup(original)
                    .build());

            // When
            SamTerminalFlowExecution execution = facade.getFlowExecutor().execute(flow, Map.of("price", 75)).block();

            // Then
            assertNotNull(execution);
            assertTrue(execution.getNodeResult("high").isPresent());
            assertFalse(execution.getNodeResult("low").isPresent());
        }

        @Test
        @DisplayName("should take the true branch of a node without conditions for either operator")
        void shouldPassEmptyConditionNode() {
            for (SamTerminalLogicalOperator operator : SamTerminalLogicalOperator.values()) {
                // Given
                SamTerminalFlow flow = priceFlow(SamTerminalConditionNodeData.builder()
                        .conditions(List.of())
                        .operator(operator)
                        .build());

                // When
                SamTerminalFlowExecution execution = facade.getFlowExecutor().execute(flow, Map.of("price", 75)).block();

                // Then
                assertNotNull(execution);
                assertTrue(execution.getNodeResult("high").isPresent(), "operator " + operator);
                assertFalse(execution.getNodeResult("low").isPresent(), "operator " + operator);
                assertEquals(true, execution.getVariable(SamTerminalConstants.CONDITION_RESULT_VARIABLE));
            }
        }

        @Test
        @DisplayName("should follow conditional edges only when their condition holds")
        void shouldFollowConditionalEdges() {
            // Given
            SamTerminalFlow flow = flow(
                    List.of(
                            trigger(),
                            action("quote", "echo", Map.of("price", "{{price}}")),
                            action("high", "echo", Map.of("branch", "high")),
                            action("low", "echo", Map.of("branch", "low"))),
                    List.of(
                            SamTerminalFlowEdge.of("trigger", "quote"),
                            SamTerminalFlowEdge.ofCondition("quote", "high", gt("_lastOutput.price", 50)),
                            SamTerminalFlowEdge.ofCondition("quote", "low", lte("_lastOutput.price", 50))));

            // When
            SamTerminalFlowExecution execution = facade.getFlowExecutor().execute(flow, Map.of("price", 40)).block();

            // Then
            assertNotNull(execution);
            assertTrue(execution.getNodeResult("low").isPresent());
            assertFalse(execution.getNodeResult("high").isPresent());
        }

        @Test
        @DisplayName("should run every plain outgoing edge in declaration order")
        void shouldFanOut() {
            // Given
            SamTerminalFlow flow = flow(
                    List.of(
                            trigger(),
                            action("first", "echo", Map.of("n", 1)),
                            action("second", "echo", Map.of("n", 2))),
                    List.of(SamTerminalFlowEdge.of("trigger", "first"), SamTerminalFlowEdge.of("trigger", "second")));

            // When
            SamTerminalFlowExecution execution = facade.getFlowExecutor().execute(flow, Map.of()).block();

            // Then
            assertNotNull(execution);
            assertEquals(List.of("trigger", "first", "second"), List.copyOf(execution.getNodeResults().keySet()));
            assertEquals(Map.of("n", 2), execution.getVariable(SamTerminalConstants.LAST_OUTPUT_VARIABLE));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("should fail the execution when a failing node has no failure edge")
        void shouldFailWithoutFailureEdge() {
            // Given
            SamTerminalFlow flow = flow(
                    List.of(trigger(), action("swap", "boom", Map.of()), output()),
                    List.of(SamTerminalFlowEdge.of("trigger", "swap"), SamTerminalFlowEdge.of("swap", "output")));

            // When
            StepVerifier.create(facade.getFlowExecutor().execute(flow, Map.of()))
                    .expectError(SamTerminalActionExecutionException.class)
                    .verify();

            // Then
            List<SamTerminalFlowExecution> executions = facade.getFlowExecutor().getExecutions("flow-1");
            assertEquals(1, executions.size());
            SamTerminalFlowExecution execution = executions.get(0);
            assertEquals(SamTerminalFlowExecutionStatus.FAILED, execution.getStatus());
            assertNotNull(execution.getError());

            SamTerminalNodeExecutionResult swap = execution.getNodeResult("swap").orElseThrow();
            assertEquals(SamTerminalNodeExecutionStatus.FAILED, swap.getStatus());
            assertEquals("exploded", swap.getError());
            assertEquals(SamTerminalInternalErrorCodes.ACTION_EXECUTION_FAILED.getErrorCode(), swap.getErrorCode());
            assertFalse(execution.getNodeResult("output").isPresent());
        }

        @Test
        @DisplayName("should route a thrown error over the failure edge and complete")
        void shouldRecoverThrownError() {
            // Given
            SamTerminalFlow flow = flow(
                    List.of(trigger(), action("swap", "boom", Map.of()), action("alert", "handle", Map.of()), output()),
                    List.of(
                            SamTerminalFlowEdge.of("trigger", "swap"),
                            SamTerminalFlowEdge.of("swap", "output"),
                            SamTerminalFlowEdge.ofFailure("swap", "alert")));

            // When
            SamTerminalFlowExecution execution = facade.getFlowExecutor().execute(flow, Map.of()).block();

            // Then
            assertNotNull(execution);
            assertEquals(SamTerminalFlowExecutionStatus.COMPLETED, execution.getStatus());

            Map<String, Object> expectedError = Map.of("message", "exploded", "nodeId", "swap", "nodeName", "swap");
            assertEquals(expectedError, execution.getVariable(SamTerminalConstants.ERROR_VARIABLE));
            assertEquals(Map.of("handled", expectedError), outputOf(execution, "alert"));

            SamTerminalNodeExecutionResult swap = execution.getNodeResult("swap").orElseThrow();
            assertTrue(swap.isRecovered());
            assertEquals(SamTerminalNodeExecutionStatus.COMPLETED, swap.getStatus());
            assertFalse(execution.getNodeResult("output").isPresent());
        }

        @Test
        @DisplayName("should route a reported failure like a thrown one")
        void shouldRecoverReportedFailure() {
            // Given
            SamTerminalFlow flow = flow(
                    List.of(trigger(), action("transfer", "reportFailure", Map.of()), action("alert", "handle", Map.of())),
                    List.of(SamTerminalFlowEdge.of("trigger", "transfer"), SamTerminalFlowEdge.ofFailure("transfer", "alert")));

            // When
            SamTerminalFlowExecution execution = facade.getFlowExecutor().execute(flow, Map.of()).block();

            // Then
            assertNotNull(execution);
            assertEquals(SamTerminalFlowExecutionStatus.COMPLETED, execution.getStatus());
            @SuppressWarnings("unchecked")
            Map<String, Object> error = (Map<String, Object>) execution.getVariable(SamTerminalConstants.ERROR_VARIABLE);
            assertEquals("insufficient funds", error.get("message"));
            assertTrue(execution.getNodeResult("transfer").orElseThrow().isRecovered());
        }

        @Test
        @DisplayName("should fail when the failure path itself fails")
        void shouldFailWhenRecoveryFails() {
            SamTerminalFlow flow = flow(
                    List.of(trigger(), action("swap", "boom", Map.of()), action("retry", "boom", Map.of())),
                    List.of(SamTerminalFlowEdge.of("trigger", "swap"), SamTerminalFlowEdge.ofFailure("swap", "retry")));

            StepVerifier.create(facade.getFlowExecutor().execute(flow, Map.of()))
                    .expectError(SamTerminalActionExecutionException.class)
                    .verify();

            SamTerminalFlowExecution execution = facade.getFlowExecutor().getExecutions("flow-1").get(0);
            assertEquals(SamTerminalFlowExecutionStatus.FAILED, execution.getStatus());
            assertFalse(execution.getNodeResult("swap").orElseThrow().isRecovered());
        }

        @Test
        @DisplayName("should fail on an action that is not registered")
        void shouldFailOnUnknownAction() {
            SamTerminalFlow flow = flow(
                    List.of(trigger(), action("swap", "nope", Map.of())),
                    List.of(SamTerminalFlowEdge.of("trigger", "swap")));

            StepVerifier.create(facade.getFlowExecutor().execute(flow, Map.of()))
                    .expectError(SamTerminalActionNotFound.class)
                    .verify();
        }

        @Test
        @DisplayName("should reject an invalid flow before recording an execution")
        void shouldRejectInvalidFlow() {
            SamTerminalFlow flow = flow(List.of(action("swap", "echo", Map.of())), List.of());

            StepVerifier.create(facade.getFlowExecutor().execute(flow, Map.of()))
                    .expectError(SamTerminalFlowValidationException.class)
                    .verify();

            assertTrue(facade.getFlowExecutor().getExecutions("flow-1").isEmpty());
        }

        @Test
        @DisplayName("should stop a cyclic flow at the visit limit")
        void shouldStopAtVisitLimit() {
            // Given
            SamTerminalFacade engine = engineWith(SamTerminalFlowEngineConfig.builder()
                    .validateBeforeExecute(false)
                    .maxNodeVisits(10)
                    .build());
            SamTerminalFlow flow = flow(
                    List.of(trigger(), action("a", "echo", Map.of()), action("b", "echo", Map.of())),
                    List.of(
                            SamTerminalFlowEdge.of("trigger", "a"),
                            SamTerminalFlowEdge.of("a", "b"),
                            SamTerminalFlowEdge.of("b", "a")));

            // When / Then
            StepVerifier.create(engine.getFlowExecutor().execute(flow, Map.of()))
                    .expectErrorMatches(throwable -> throwable instanceof SamTerminalFlowNodeExecutionException nodeException
                            && nodeException.getErrorInfo() == SamTerminalInternalErrorCodes.FLOW_NODE_VISIT_LIMIT_EXCEEDED)
                    .verify();
        }
    }

    @Nested
    @DisplayName("Loops and delays")
    class LoopAndDelayTests {

        @Test
        @DisplayName("should produce the iteration indexes of a count loop")
        void shouldRunCountLoop() {
            SamTerminalFlow flow = flow(
                    List.of(trigger(), SamTerminalFlowNode.of("loop", "Loop", SamTerminalLoopNodeData.builder().count(3).build())),
                    List.of(SamTerminalFlowEdge.of("trigger", "loop")));

            SamTerminalFlowExecution execution = facade.getFlowExecutor().execute(flow, Map.of()).block();

            assertNotNull(execution);
            assertEquals(List.of(0, 1, 2), outputOf(execution, "loop"));
            assertEquals(List.of(0, 1, 2), execution.getVariable(SamTerminalConstants.LOOP_ITEMS_VARIABLE));
        }

        @Test
        @DisplayName("should produce the items of a for each loop")
        void shouldRunForEachLoop() {
            SamTerminalFlow flow = flow(
                    List.of(trigger(), SamTerminalFlowNode.of("loop", "Loop", SamTerminalLoopNodeData.builder()
                            .loopType(SamTerminalLoopType.FOR_EACH)
                            .items("{{watchlist.tokens}}")
                            .build())),
                    List.of(SamTerminalFlowEdge.of("trigger", "loop")));

            SamTerminalFlowExecution execution = facade.getFlowExecutor()
                    .execute(flow, Map.of("watchlist", Map.of("tokens", List.of("ETH", "BTC"))))
                    .block();

            assertNotNull(execution);
            assertEquals(List.of("ETH", "BTC"), outputOf(execution, "loop"));
        }

        @Test
        @DisplayName("should fail a loop above the iteration limit")
        void shouldEnforceLoopLimit() {
            // Given
            SamTerminalFacade engine = engineWith(SamTerminalFlowEngineConfig.builder().maxLoopIterations(2).build());
            SamTerminalFlow flow = flow(
                    List.of(trigger(), SamTerminalFlowNode.of("loop", "Loop", SamTerminalLoopNodeData.builder().count(3).build())),
                    List.of(SamTerminalFlowEdge.of("trigger", "loop")));

            // When
            StepVerifier.create(engine.getFlowExecutor().execute(flow, Map.of()))
                    .expectError(SamTerminalFlowNodeExecutionException.class)
                    .verify();

            // Then
            SamTerminalNodeExecutionResult loop = engine.getFlowExecutor().getExecutions("flow-1").get(0)
                    .getNodeResult("loop").orElseThrow();
            assertEquals(SamTerminalInternalErrorCodes.FLOW_LOOP_LIMIT_EXCEEDED.getErrorCode(), loop.getErrorCode());
        }

        @Test
        @DisplayName("should wait for a fixed delay")
        void shouldDelay() {
            SamTerminalFlow flow = flow(
                    List.of(trigger(), SamTerminalFlowNode.of("wait", "Wait", SamTerminalDelayNodeData.builder().delayMs(20).build())),
                    List.of(SamTerminalFlowEdge.of("trigger", "wait")));

            SamTerminalFlowExecution execution = facade.getFlowExecutor().execute(flow, Map.of()).block();

            assertNotNull(execution);
            assertEquals(Map.of("delayedMs", 20L), outputOf(execution, "wait"));
            assertEquals(SamTerminalFlowExecutionStatus.COMPLETED, execution.getStatus());
        }

        @Test
        @DisplayName("should pick a random delay within the bounds")
        void shouldDelayRandomly() {
            // Given
            SamTerminalFacade engine = engineWith(SamTerminalFlowEngineConfig.builder().random(new Random(42)).build());
            SamTerminalFlow flow = flow(
                    List.of(trigger(), SamTerminalFlowNode.of("wait", "Wait", SamTerminalDelayNodeData.builder()
                            .delayMs(5)
                            .maxDelayMs(25L)
                            .delayType(SamTerminalDelayType.RANDOM)
                            .build())),
                    List.of(SamTerminalFlowEdge.of("trigger", "wait")));

            // When
            SamTerminalFlowExecution execution = engine.getFlowExecutor().execute(flow, Map.of()).block();

            // Then
            assertNotNull(execution);
            @SuppressWarnings("unchecked")
            long delayedMs = (Long) ((Map<String, Object>) outputOf(execution, "wait")).get("delayedMs");
            assertTrue(delayedMs >= 5 && delayedMs <= 25, "delay " + delayedMs);
        }

        @Test
        @DisplayName("should reject a negative delay")
        void shouldRejectNegativeDelay() {
            SamTerminalFlow flow = flow(
                    List.of(trigger(), SamTerminalFlowNode.of("wait", "Wait", SamTerminalDelayNodeData.builder().delayMs(-1).build())),
                    List.of(SamTerminalFlowEdge.of("trigger", "wait")));

            StepVerifier.create(facade.getFlowExecutor().execute(flow, Map.of()))
                    .expectErrorMatches(throwable -> throwable instanceof SamTerminalFlowNodeExecutionException nodeException
                            && nodeException.getErrorInfo() == SamTerminalInternalErrorCodes.FLOW_NODE_DATA_INVALID)
                    .verify();
        }
    }
}
