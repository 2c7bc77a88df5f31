package com.caseflow.orchestrator.core.engine;

import com.caseflow.orchestrator.integration.models.cases.CaseFlowCase;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCaseCreateRequest;
import com.caseflow.orchestrator.integration.models.run.CaseFlowCaseState;
import com.caseflow.orchestrator.integration.models.run.CaseFlowRunResult;
import com.caseflow.orchestrator.integration.models.run.CaseFlowStatistics;
import reactor.core.publisher.Mono;

/**
 * Entry point of the orchestrator: case lifecycle, workflow triggers and inspection.
 */
public interface ICaseFlowOrchestrator {

    /**
     * Initializes the stores, starts the poller and re-arms loops of interventions left pending.
     */
    Mono<Void> start();

    Mono<Void> shutdown();

    Mono<CaseFlowCase> createCase(CaseFlowCaseCreateRequest request);

    Mono<CaseFlowRunResult> run(String caseId);

    Mono<CaseFlowRunResult> run(String caseId, String seedMessage);

    /**
     * Stores {@code value} under the first missing field of the pending intervention, or under the
     * plugin's primary input field when nothing is pending. The workflow itself is resumed by the poller.
     */
    Mono<CaseFlowCase> provideMissingInput(String caseId, String value);

    Mono<CaseFlowCase> provideMissingInput(String caseId, String field, String value);

    Mono<CaseFlowCaseState> getCaseState(String caseId);

    Mono<Boolean> stopPolling(String caseId);

    /**
     * Stops polling, drops the checkpoint, then removes the case with its logs. Intervention
     * records are kept.
     */
    Mono<Boolean> deleteCase(String caseId);

    Mono<CaseFlowStatistics> getStatistics();
}
