package com.samterminal.integration.models.actions;

import com.samterminal.integration.contract.action.ISamTerminalActionResult;
import lombok.Data;

@Data
public class SamTerminalActionOutput implements ISamTerminalActionResult {
    private final boolean success;
    private final Object data;
    private final String error;

    private SamTerminalActionOutput(boolean success, Object data, String error) {
        this.success = success;
        this.data = data;
        this.error = error;
    }

    public static SamTerminalActionOutput of(boolean success, Object data, String error) {
        return new SamTerminalActionOutput(success, data, error);
    }

    public static SamTerminalActionOutput ofData(Object data) {
        return new SamTerminalActionOutput(true, data, null);
    }

    public static SamTerminalActionOutput ofEmpty() {
        return new SamTerminalActionOutput(true, null, null);
    }

    public static SamTerminalActionOutput ofFailure(String error) {
        return new SamTerminalActionOutput(false, null, error);
    }

}
