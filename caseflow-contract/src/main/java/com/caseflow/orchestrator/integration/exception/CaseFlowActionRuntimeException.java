package com.caseflow.orchestrator.integration.exception;

import com.caseflow.orchestrator.integration.contract.ICaseFlowErrorInfo;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

@Getter
@ToString
public class CaseFlowActionRuntimeException extends RuntimeException implements ICaseFlowActionException {
    protected final ICaseFlowErrorInfo errorInfo;
    protected final Map<String, String> templateVariables;
    protected final Throwable rootCause;
    protected final Object additionalInfo;

    public CaseFlowActionRuntimeException(
            ICaseFlowErrorInfo errorInfo,
            Map<String, String> templateVariables,
            Throwable rootCause,
            Object additionalInfo) {

        super(formatMessage(errorInfo, templateVariables), rootCause);
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables == null ? Map.of() : Map.copyOf(templateVariables);
        this.rootCause = rootCause;
        this.additionalInfo = additionalInfo;
    }

    public CaseFlowActionRuntimeException(ICaseFlowErrorInfo errorInfo) {
        this(errorInfo, Map.of(), null, null);
    }

    public CaseFlowActionRuntimeException(ICaseFlowErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, null, null);
    }

    public CaseFlowActionRuntimeException(ICaseFlowErrorInfo errorInfo, Throwable rootCause) {
        this(errorInfo, Map.of(), rootCause, null);
    }

    /**
     * Replaces {@code {name}} placeholders of the error template with template variables.
     */
    public static String formatMessage(ICaseFlowErrorInfo errorInfo, Map<String, String> templateVariables) {
        if (errorInfo == null) {
            return null;
        }
        String message = errorInfo.getErrorTemplate();
        if (templateVariables != null) {
            for (Map.Entry<String, String> variable : templateVariables.entrySet()) {
                message = message.replace("{" + variable.getKey() + "}", String.valueOf(variable.getValue()));
            }
        }
        return "[" + errorInfo.getErrorCode() + "] " + message;
    }
}
