package com.caseflow.orchestrator.integration.exception;

import com.caseflow.orchestrator.integration.contract.ICaseFlowErrorInfo;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * Raised by an action executor, before it writes anything, when an input it needs is absent.
 */
@Getter
public class CaseFlowPreconditionException extends CaseFlowActionRuntimeException {

    private final String actionLabel;
    private final List<String> missingFields;

    public CaseFlowPreconditionException(ICaseFlowErrorInfo errorInfo, String actionLabel, List<String> missingFields) {
        super(errorInfo, Map.of("action", actionLabel, "fields", String.join(", ", missingFields)), null, missingFields);
        this.actionLabel = actionLabel;
        this.missingFields = List.copyOf(missingFields);
    }
}
