package com.samterminal.core.exception.action;

import com.samterminal.integration.contract.ISamTerminalErrorInfo;
import com.samterminal.integration.exception.ISamTerminalActionException;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.Optional;

/**
 * Failure of a single action invocation, thrown or reported. The original throwable, if any,
 * is the cause.
 */
@Getter
@ToString
public class SamTerminalActionExecutionException extends RuntimeException {
    private static final String ERROR_MESSAGE_TEMPLATE = "Action Execution Failed. " +
            "Action: [%s], " +
            "ErrorCode: [%s], " +
            "Reason: [%s], " +
            "TemplateVariables: [%s], " +
            "AdditionalInfo: [%s]";

    public static final String REPORTED_ERROR_KEY = "error";

    private final String qualifiedActionName;
    private final ISamTerminalErrorInfo errorInfo;
    private final Map<String, String> templateVariables;
    private final Throwable rootCause;
    private final Object additionalInfo;

    public SamTerminalActionExecutionException(
            String qualifiedActionName,
            ISamTerminalErrorInfo errorInfo,
            Throwable rootCause) {
        this(qualifiedActionName, errorInfo, Map.of(), rootCause, null);
    }

    public SamTerminalActionExecutionException(
            String qualifiedActionName,
            ISamTerminalErrorInfo errorInfo,
            Object additionalInfo) {
        this(qualifiedActionName, errorInfo, Map.of(), null, additionalInfo);
    }

    public SamTerminalActionExecutionException(
            String qualifiedActionName,
            ISamTerminalActionException actionException) {

        this(
                qualifiedActionName,
                actionException.getErrorInfo(),
                actionException.getTemplateVariables(),
                actionException.getRootCause(),
                actionException.getAdditionalInfo(),
                actionException instanceof Throwable throwable ? throwable : actionException.getRootCause()
        );
    }

    public static SamTerminalActionExecutionException ofReportedFailure(
            String qualifiedActionName,
            ISamTerminalErrorInfo errorInfo,
            String reportedError) {

        return new SamTerminalActionExecutionException(
                qualifiedActionName,
                errorInfo,
                Map.of(REPORTED_ERROR_KEY, Optional.ofNullable(reportedError).orElse("unknown error")),
                null,
                null);
    }

    public SamTerminalActionExecutionException(
            String qualifiedActionName,
            ISamTerminalErrorInfo errorInfo,
            Map<String, String> templateVariables,
            Throwable rootCause,
            Object additionalInfo) {
        this(qualifiedActionName, errorInfo, templateVariables, rootCause, additionalInfo, rootCause);
    }

    private SamTerminalActionExecutionException(
            String qualifiedActionName,
            ISamTerminalErrorInfo errorInfo,
            Map<String, String> templateVariables,
            Throwable rootCause,
            Object additionalInfo,
            Throwable cause) {

        super(
                String.format(
                        ERROR_MESSAGE_TEMPLATE,
                        qualifiedActionName,
                        errorInfo.getErrorCode(),
                        reason(errorInfo, templateVariables, rootCause),
                        templateVariables,
                        additionalInfo
                ),
                cause
        );
        this.qualifiedActionName = qualifiedActionName;
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables;
        this.rootCause = rootCause;
        this.additionalInfo = additionalInfo;
    }

    /**
     * @return the message of the root cause, the error an action reported, or the error template
     * with its {@code {placeholders}} filled from the template variables
     */
    public String getReason() {
        return reason(errorInfo, templateVariables, rootCause);
    }

    private static String reason(ISamTerminalErrorInfo errorInfo, Map<String, String> templateVariables, Throwable rootCause) {
        if (rootCause != null && rootCause.getMessage() != null) {
            return rootCause.getMessage();
        }
        if (templateVariables != null && templateVariables.containsKey(REPORTED_ERROR_KEY)) {
            return templateVariables.get(REPORTED_ERROR_KEY);
        }
        String rendered = errorInfo.getErrorTemplate();
        if (rendered != null && templateVariables != null) {
            for (Map.Entry<String, String> variable : templateVariables.entrySet()) {
                rendered = rendered.replace("{" + variable.getKey() + "}", String.valueOf(variable.getValue()));
            }
        }
        return rendered;
    }

}
