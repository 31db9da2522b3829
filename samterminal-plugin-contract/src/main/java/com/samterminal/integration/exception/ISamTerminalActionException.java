package com.samterminal.integration.exception;

import com.samterminal.integration.contract.ISamTerminalErrorInfo;

import java.util.Map;

public interface ISamTerminalActionException {
    ISamTerminalErrorInfo getErrorInfo();
    Map<String, String> getTemplateVariables();
    Throwable getRootCause();
    Object getAdditionalInfo();
}
