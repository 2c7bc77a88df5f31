package com.caseflow.orchestrator.integration.contract.precondition;

import com.caseflow.orchestrator.integration.contract.ICaseFlowCase;

import java.util.List;

/**
 * A required input whose absence suspends a workflow and raises a human intervention.
 */
public interface ICaseFlowPrecondition {

    /**
     * Intervention kind raised when this precondition is unmet, e.g. MISSING_TRANSCRIPT.
     */
    String getKind();

    String getReason();

    /**
     * Names of the fields that are currently missing or unusable; empty when satisfied.
     */
    List<String> findMissingFields(ICaseFlowCase caseFlowCase);

    default boolean isSatisfied(ICaseFlowCase caseFlowCase) {
        return findMissingFields(caseFlowCase).isEmpty();
    }
}
