package com.caseflow.orchestrator.integration.contract;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowErrorCategory;

public interface ICaseFlowErrorInfo {
    String getErrorCode();
    CaseFlowErrorCategory getCategory();
    String getErrorTemplate();
}
