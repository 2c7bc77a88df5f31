package com.caseflow.orchestrator.integration.enumerations;

/**
 * Classifies entries of a case's append-only action log.
 */
public enum CaseFlowLogType {
    INFO,
    STEP,
    DECISION,
    INTERVENTION,
    POLLING,
    RESUME,
    INPUT,
    ERROR
}
