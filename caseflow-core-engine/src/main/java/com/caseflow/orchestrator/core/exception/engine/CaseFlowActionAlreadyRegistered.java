package com.caseflow.orchestrator.core.exception.engine;

import com.caseflow.orchestrator.core.exception.CaseFlowRuntimeException;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

@Getter
public class CaseFlowActionAlreadyRegistered extends CaseFlowRuntimeException {
    private final String actionLabel;

    public CaseFlowActionAlreadyRegistered(String actionLabel) {
        super(CaseFlowInternalErrorCodes.ACTION_ALREADY_REGISTERED, Map.of("action", actionLabel));
        this.actionLabel = actionLabel;
    }
}
