package com.caseflow.orchestrator.core.exception.store;

import com.caseflow.orchestrator.core.exception.CaseFlowRuntimeException;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

/**
 * A storage failure. The store's last committed state is left untouched; the engine propagates
 * this exception to its caller instead of routing it to error handling.
 */
@Getter
public class CaseFlowPersistenceException extends CaseFlowRuntimeException {
    private final String caseId;
    private final String operation;

    public CaseFlowPersistenceException(String caseId, String operation, Throwable cause) {
        super(CaseFlowInternalErrorCodes.PERSISTENCE_FAILED,
                Map.of("caseId", String.valueOf(caseId), "operation", operation), cause);
        this.caseId = caseId;
        this.operation = operation;
    }
}
