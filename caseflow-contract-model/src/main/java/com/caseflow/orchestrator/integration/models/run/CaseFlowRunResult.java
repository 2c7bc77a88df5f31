package com.caseflow.orchestrator.integration.models.run;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowExecutionState;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one engine invocation. {@code messages} always holds the full trace of the run.
 */
@Data
@Builder
public class CaseFlowRunResult {

    private final String caseId;
    private final String runId;
    private final CaseFlowExecutionState executionState;
    private final String currentStatus;
    private final String lastAction;
    private final String reasoning;
    private final int stepCount;

    @Builder.Default
    private final List<String> messages = new ArrayList<>();

    @Builder.Default
    private final List<String> completedActions = new ArrayList<>();

    private final boolean waitingForInput;
    private final boolean pollingActive;

    @Builder.Default
    private final List<String> missingFields = new ArrayList<>();

    /**
     * Set when a guard ended the run.
     */
    private final String diagnostic;
}
