package com.samterminal.integration.exception;

import com.samterminal.integration.contract.ISamTerminalErrorInfo;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Thrown by plugin code to fail an action with a coded error.
 */
@Getter
@ToString
public class SamTerminalActionRuntimeException extends RuntimeException implements ISamTerminalActionException {
    protected final ISamTerminalErrorInfo errorInfo;
    protected final Map<String, String> templateVariables;
    protected final Throwable rootCause;
    protected final Object additionalInfo;

    public SamTerminalActionRuntimeException(
            ISamTerminalErrorInfo errorInfo,
            Map<String, String> templateVariables,
            Throwable rootCause,
            Object additionalInfo) {

        super(errorInfo.getErrorCode() + ": " + errorInfo.getErrorTemplate(), rootCause);
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables;
        this.rootCause = rootCause;
        this.additionalInfo = additionalInfo;
    }

    public SamTerminalActionRuntimeException(ISamTerminalErrorInfo errorInfo) {
        this(errorInfo, Map.of(), null, null);
    }

    public SamTerminalActionRuntimeException(ISamTerminalErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, null, null);
    }

    public SamTerminalActionRuntimeException(ISamTerminalErrorInfo errorInfo, Throwable rootCause) {
        this(errorInfo, Map.of(), rootCause, null);
    }

}
