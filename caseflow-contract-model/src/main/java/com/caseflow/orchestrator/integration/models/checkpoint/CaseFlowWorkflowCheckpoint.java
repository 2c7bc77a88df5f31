package com.caseflow.orchestrator.integration.models.checkpoint;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowExecutionState;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecision;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Persisted engine state of a case, sufficient to resume a suspended run.
 *
 * <p>There is at most one checkpoint per case and only the workflow engine writes it.
 * Within a run {@code completedActions} only grows; a new run starts after the previous one
 * reached a terminal state.
 *
 * <h2>State Components</h2>
 * <ul>
 *   <li><b>Run identity:</b> run id and run number</li>
 *   <li><b>Execution state:</b> current state, action being executed, last decision</li>
 *   <li><b>Trace:</b> ordered human-readable messages of the run</li>
 *   <li><b>Counters:</b> steps of the current invocation and of the whole run</li>
 * </ul>
 */
@Data
@Builder(toBuilder = true)
@With
@Jacksonized
public class CaseFlowWorkflowCheckpoint implements Serializable {

    private static final long serialVersionUID = 1L;

    // ========================================================================
    // IDENTITY
    // ========================================================================

    private final String caseId;

    private final String runId;

    private final int runNumber;

    // ========================================================================
    // EXECUTION STATE
    // ========================================================================

    private final CaseFlowExecutionState executionState;

    /**
     * Label of the action being executed, null while deciding.
     */
    private final String currentAction;

    private final CaseFlowDecision lastDecision;

    /**
     * Completed actions of the current run in completion order, without duplicates.
     */
    @Builder.Default
    private final List<String> completedActions = new ArrayList<>();

    @Builder.Default
    private final List<String> messages = new ArrayList<>();

    // ========================================================================
    // COUNTERS & TIMESTAMPS
    // ========================================================================

    private final int stepCount;

    private final int totalSteps;

    private final Instant createdAt;

    private final Instant updatedAt;

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    @JsonIgnore
    public boolean isTerminal() {
        return executionState != null && executionState.isTerminal();
    }

    public boolean hasCompleted(String action) {
        return completedActions.contains(action);
    }
}
