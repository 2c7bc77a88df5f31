package com.caseflow.orchestrator.integration.enumerations;

public enum CaseFlowErrorCategory {
    ORACLE_PATH,
    PRECONDITION,
    ACTION,
    PERSISTENCE,
    LOOP_GUARD,
    NOT_FOUND,
    CONFLICT,
    VALIDATION
}
