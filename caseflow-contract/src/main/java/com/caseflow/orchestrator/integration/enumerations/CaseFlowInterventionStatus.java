package com.caseflow.orchestrator.integration.enumerations;

public enum CaseFlowInterventionStatus {
    PENDING,
    RESOLVED
}
