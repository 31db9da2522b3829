package com.samterminal.integration.contract.action;

public interface ISamTerminalAction {
    String getName();
    String getDescription();

    /**
     * Type the raw node params are converted into before the action runs.
     * {@code Map.class} keeps the params as they are.
     */
    Class<?> getInputType();

    ISamTerminalActionInputValidator getInputValidator();
    ISamTerminalActionFunction getActionFunction();
}
