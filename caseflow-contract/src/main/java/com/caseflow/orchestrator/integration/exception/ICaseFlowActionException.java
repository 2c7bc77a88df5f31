package com.caseflow.orchestrator.integration.exception;

import com.caseflow.orchestrator.integration.contract.ICaseFlowErrorInfo;

import java.util.Map;

public interface ICaseFlowActionException {
    ICaseFlowErrorInfo getErrorInfo();
    Map<String, String> getTemplateVariables();
    Throwable getRootCause();
    Object getAdditionalInfo();
}
