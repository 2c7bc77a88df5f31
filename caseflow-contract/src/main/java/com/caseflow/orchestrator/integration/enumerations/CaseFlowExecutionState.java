package com.caseflow.orchestrator.integration.enumerations;

/**
 * Execution state of a case workflow run, as recorded in its checkpoint.
 */
public enum CaseFlowExecutionState {

    /**
     * The engine is asking the decision oracle for the next action.
     */
    DECIDING,

    /**
     * An action executor is running.
     */
    EXECUTING,

    /**
     * The run is suspended until a missing input is supplied.
     * A polling loop is normally armed while a case sits in this state.
     */
    AWAITING_INTERVENTION,

    /**
     * The oracle chose to complete, or the repeat guard forced completion.
     */
    COMPLETED,

    /**
     * The run stopped because a guard tripped.
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
