package com.caseflow.orchestrator.core.exception.store;

import com.caseflow.orchestrator.core.exception.CaseFlowRuntimeException;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

@Getter
public class CaseFlowCaseAlreadyExists extends CaseFlowRuntimeException {
    private final String caseId;

    public CaseFlowCaseAlreadyExists(String caseId) {
        super(CaseFlowInternalErrorCodes.CASE_ALREADY_EXISTS, Map.of("caseId", caseId));
        this.caseId = caseId;
    }
}
