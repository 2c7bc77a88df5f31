package com.caseflow.orchestrator.integration.enumerations;

/**
 * What the engine does when the oracle picks an action that already completed in the current run.
 * The reserved labels wait, error and complete are never subject to this policy.
 */
public enum CaseFlowRepeatActionPolicy {

    /**
     * Replace the decision with complete.
     */
    FORCE_COMPLETE,

    /**
     * Treat the decision as an oracle error and route to error handling.
     */
    ROUTE_TO_ERROR,

    /**
     * End the run in the FAILED state.
     */
    FAIL
}
