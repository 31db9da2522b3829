package com.samterminal.integration.contract;

public interface ISamTerminalErrorInfo {
    String getErrorCode();
    String getErrorTemplate();
    String getResolutionTemplate();
}
