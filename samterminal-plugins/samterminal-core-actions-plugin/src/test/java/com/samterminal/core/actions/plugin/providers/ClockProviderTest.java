package com.samterminal.core.actions.plugin.providers;

import com.samterminal.core.actions.plugin.CoreActionsTestEngine;
import com.samterminal.core.engine.SamTerminalFacade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClockProviderTest {

    private SamTerminalFacade facade;

    @BeforeEach
    void setUp() {
        facade = CoreActionsTestEngine.start();
    }

    @Test
    @DisplayName("should default to UTC")
    void shouldDefaultToUtc() {
        long before = System.currentTimeMillis();

        StepVerifier.create(facade.getActionExecutor().getData("core", "clock", Map.of()))
                .assertNext(result -> {
                    assertTrue(result.isSuccess());
                    Map<?, ?> data = (Map<?, ?>) result.getData();
                    assertEquals("UTC", data.get("zone"));
                    assertTrue((Long) data.get("epochMillis") >= before);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should use the requested zone")
    void shouldUseRequestedZone() {
        StepVerifier.create(facade.getActionExecutor().getData("core", "clock", Map.of("zone", "Asia/Tokyo")))
                .assertNext(result -> {
                    Map<?, ?> data = (Map<?, ?>) result.getData();
                    assertEquals("Asia/Tokyo", data.get("zone"));
                    assertTrue(data.get("iso").toString().endsWith("[Asia/Tokyo]"));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("should report an invalid zone as a failed result")
    void shouldReportInvalidZone() {
        StepVerifier.create(facade.getActionExecutor().getData("core", "clock", Map.of("zone", "Mars/Olympus")))
                .assertNext(result -> {
                    assertFalse(result.isSuccess());
                    assertNull(result.getData());
                    assertNotNull(result.getError());
                })
                .verifyComplete();
    }
}
