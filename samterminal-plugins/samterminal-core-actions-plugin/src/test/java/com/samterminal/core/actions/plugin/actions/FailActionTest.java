package com.samterminal.core.actions.plugin.actions;

import com.samterminal.core.actions.plugin.CoreActionsTestEngine;
import com.samterminal.core.engine.SamTerminalFacade;
import com.samterminal.core.exception.action.SamTerminalActionExecutionException;
import com.samterminal.core.exception.codes.SamTerminalInternalErrorCodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FailActionTest {

    private SamTerminalFacade facade;

    @BeforeEach
    void setUp() {
        facade = CoreActionsTestEngine.start();
    }

    @Test
    @DisplayName("should raise a coded error by default")
    void shouldRaiseError() {
        StepVerifier.create(CoreActionsTestEngine.execute(facade, "fail", Map.of("message", "disk full")))
                .expectErrorSatisfies(throwable -> {
                    SamTerminalActionExecutionException error = (SamTerminalActionExecutionException) throwable;
                    assertEquals(FailAction.FailActionErrorCodes.FAIL_ACTION_REQUESTED_FAILURE, error.getErrorInfo());
                    assertEquals("Failure requested: disk full", error.getReason());
                })
                .verify();
    }

    @Test
    @DisplayName("should report an unsuccessful result in report mode")
    void shouldReportFailure() {
        StepVerifier.create(CoreActionsTestEngine.execute(facade, "fail", Map.of("message", "disk full", "report", true)))
                .expectErrorSatisfies(throwable -> {
                    SamTerminalActionExecutionException error = (SamTerminalActionExecutionException) throwable;
                    assertEquals(SamTerminalInternalErrorCodes.ACTION_REPORTED_FAILURE, error.getErrorInfo());
                    assertEquals("disk full", error.getReason());
                })
                .verify();
    }

    @Test
    @DisplayName("should use a default message")
    void shouldUseDefaultMessage() {
        StepVerifier.create(CoreActionsTestEngine.execute(facade, "fail", Map.of()))
                .expectErrorSatisfies(throwable -> assertEquals(
                        "Failure requested: failure requested",
                        ((SamTerminalActionExecutionException) throwable).getReason()))
                .verify();
    }
}
