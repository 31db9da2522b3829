package com.samterminal.integration.contract.action;

import com.samterminal.integration.exception.SamTerminalActionRuntimeException;

@FunctionalInterface
public interface ISamTerminalActionInputValidator {
    ISamTerminalActionInputValidator NOOP = input -> {};

    void validate(Object input) throws SamTerminalActionRuntimeException;
}
