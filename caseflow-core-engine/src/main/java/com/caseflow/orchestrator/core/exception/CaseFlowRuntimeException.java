package com.caseflow.orchestrator.core.exception;

import com.caseflow.orchestrator.integration.contract.ICaseFlowErrorInfo;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowErrorCategory;
import com.caseflow.orchestrator.integration.exception.CaseFlowActionRuntimeException;
import lombok.Getter;

import java.util.Map;

@Getter
public class CaseFlowRuntimeException extends RuntimeException {
    private final ICaseFlowErrorInfo errorInfo;
    private final Map<String, String> templateVariables;

    public CaseFlowRuntimeException(ICaseFlowErrorInfo errorInfo, Map<String, String> templateVariables) {
        this(errorInfo, templateVariables, null);
    }

    public CaseFlowRuntimeException(ICaseFlowErrorInfo errorInfo, Map<String, String> templateVariables, Throwable cause) {
        super(CaseFlowActionRuntimeException.formatMessage(errorInfo, templateVariables), cause);
        this.errorInfo = errorInfo;
        this.templateVariables = templateVariables == null ? Map.of() : Map.copyOf(templateVariables);
    }

    public CaseFlowErrorCategory getCategory() {
        return errorInfo.getCategory();
    }
}
