package com.caseflow.orchestrator.core.exception.engine;

import com.caseflow.orchestrator.core.exception.CaseFlowRuntimeException;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

@Getter
public class CaseFlowActionNotFound extends CaseFlowRuntimeException {
    private final String actionLabel;

    public CaseFlowActionNotFound(String actionLabel) {
        super(CaseFlowInternalErrorCodes.ACTION_NOT_FOUND, Map.of("action", String.valueOf(actionLabel)));
        this.actionLabel = actionLabel;
    }
}
