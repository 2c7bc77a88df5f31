package com.caseflow.orchestrator.core.exception.misc;

import com.caseflow.orchestrator.core.exception.CaseFlowRuntimeException;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
public class CaseFlowValidationException extends CaseFlowRuntimeException {
    private final List<String> violations;

    public CaseFlowValidationException(List<String> violations) {
        super(CaseFlowInternalErrorCodes.VALIDATION_FAILED, Map.of("violations", String.join("; ", violations)));
        this.violations = List.copyOf(violations);
    }
}
