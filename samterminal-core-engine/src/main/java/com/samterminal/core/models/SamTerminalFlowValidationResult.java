package com.samterminal.core.models;

import lombok.Data;

import java.util.List;

@Data
public class SamTerminalFlowValidationResult {
    private final List<String> errors;
    private final List<String> warnings;

    public boolean isValid() {
        return errors.isEmpty();
    }
}
