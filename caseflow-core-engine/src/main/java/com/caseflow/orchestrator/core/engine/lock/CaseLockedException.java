package com.caseflow.orchestrator.core.engine.lock;

import com.caseflow.orchestrator.core.exception.CaseFlowRuntimeException;
import com.caseflow.orchestrator.core.exception.codes.CaseFlowInternalErrorCodes;
import lombok.Getter;

import java.util.Map;

/**
 * Thrown when an operation cannot proceed because another writer holds the case lock.
 */
@Getter
public class CaseLockedException extends CaseFlowRuntimeException {

    private static final long serialVersionUID = 1L;

    private final String caseId;
    private final String currentOwner;
    private final transient CaseLock lockInfo;

    public CaseLockedException(String caseId, String currentOwner, CaseLock lockInfo) {
        super(CaseFlowInternalErrorCodes.CASE_LOCKED,
                Map.of("caseId", caseId, "owner", currentOwner == null ? "another writer" : currentOwner));
        this.caseId = caseId;
        this.currentOwner = currentOwner;
        this.lockInfo = lockInfo;
    }

    public static CaseLockedException withLockInfo(String caseId, CaseLock lockInfo) {
        return new CaseLockedException(caseId, lockInfo != null ? lockInfo.getOwnerId() : null, lockInfo);
    }
}
