package com.caseflow.orchestrator.core.engine.workflow;

import com.caseflow.orchestrator.integration.models.run.CaseFlowRunResult;
import reactor.core.publisher.Mono;

public interface ICaseFlowWorkflowEngine {

    /**
     * Starts or resumes the workflow of a case and drives it until it completes, fails or
     * suspends for a human intervention.
     *
     * @param seedMessage first trace message of this invocation, a default start message when null
     */
    Mono<CaseFlowRunResult> run(String caseId, String seedMessage);

    /**
     * Re-enters a suspended workflow. Unlike {@link #run}, a workflow that already ended is not
     * started again: its pending intervention, if any, is closed and its last result returned.
     */
    Mono<CaseFlowRunResult> resume(String caseId, String seedMessage);
}
