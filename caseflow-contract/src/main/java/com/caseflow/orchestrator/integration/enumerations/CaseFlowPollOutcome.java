package com.caseflow.orchestrator.integration.enumerations;

/**
 * Result of a single polling tick.
 */
public enum CaseFlowPollOutcome {
    STILL_WAITING,
    RESOLVED,
    EXPIRED,
    SKIPPED_LOCKED,
    NOT_ACTIVE
}
