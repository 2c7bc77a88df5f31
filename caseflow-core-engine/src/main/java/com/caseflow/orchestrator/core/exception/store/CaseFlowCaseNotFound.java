package com.caseflow.orchestrator.core.exception.store;

import com.caseflow.orchestrator.core.exception.CaseFlowRuntimeException;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

@Getter
public class CaseFlowCaseNotFound extends CaseFlowRuntimeException {
    private final String caseId;

    public CaseFlowCaseNotFound(String caseId) {
        super(CaseFlowInternalErrorCodes.CASE_NOT_FOUND, Map.of("caseId", String.valueOf(caseId)));
        this.caseId = caseId;
    }
}
