package com.samterminal.integration.models.providers;

import com.samterminal.integration.contract.provider.ISamTerminalProviderResult;
import lombok.Data;

import java.time.Instant;

@Data
public class SamTerminalProviderOutput implements ISamTerminalProviderResult {
    private final boolean success;
    private final Object data;
    private final String error;
    private final Instant timestamp;

    private SamTerminalProviderOutput(boolean success, Object data, String error, Instant timestamp) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.timestamp = timestamp;
    }

    public static SamTerminalProviderOutput ofData(Object data) {
        return new SamTerminalProviderOutput(true, data, null, Instant.now());
    }

    public static SamTerminalProviderOutput ofFailure(String error) {
        return new SamTerminalProviderOutput(false, null, error, Instant.now());
    }

}
