package com.samterminal.integration.contract.action;

public interface ISamTerminalActionResult {
    boolean isSuccess();
    Object getData();
    String getError();
}
