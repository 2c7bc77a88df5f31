package com.caseflow.orchestrator.core.exception.engine;

import com.caseflow.orchestrator.integration.contract.ICaseFlowErrorInfo;
import com.caseflow.orchestrator.integration.exception.ICaseFlowActionException;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;
import java.util.Optional;

@Getter
@ToString
public class CaseFlowActionExecutionException extends RuntimeException {
    private static final String ERROR_MESSAGE_TEMPLATE = "Action Execution Failed. " +
            "CaseId: [%s], " +
            "Action: [%s], " +
            "ErrorCode: [%s], " +
            "TemplateVariables: [%s], " +
            "RootCause: [%s], " +
            "AdditionalInfo: [%s]";

    private final String caseId;
    private final String actionLabel;
    private final ICaseFlowErrorInfo errorInfo;
    private final Map<String, String> templateVariables;
    private final Throwable rootCause;
    private final Object additionalInfo;

    public CaseFlowActionExecutionException(
            String caseId,
            String actionLabel,
            ICaseFlowActionException actionException) {

        this(
                caseId,
                actionLabel,
                actionException.getErrorInfo(),
                actionException.getTemplateVariables(),
                actionException.getRootCause(),
                actionException.getAdditionalInfo()
        );
    }

    public CaseFlowActionExecutionException(
            String caseId,
            String actionLabel,
            ICaseFlowErrorInfo errorInfo,
            Map<String, String> templateVariables,
            Throwable rootCause,
            Object additionalInfo) {

        super(
                String.format(
                        ERROR_MESSAGE_TEMPLATE,
                        caseId,
                        actionLabel,
                        Optional.ofNullable(errorInfo).map(ICaseFlowErrorInfo::getErrorCode).orElse(null),
                        templateVariables,
                        Optional.ofNullable(rootCause).map(Throwable::getMessage).orElse(null),
                        additionalInfo
                ),
                rootCause
        );
        this.caseId = caseId;
        this.actionLabel = actionLabel;
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables;
        this.rootCause = rootCause;
        this.additionalInfo = additionalInfo;
    }
}
