package com.caseflow.orchestrator.core.engine.store;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowExecutionState;
import com.caseflow.orchestrator.integration.models.checkpoint.CaseFlowWorkflowCheckpoint;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * One checkpoint per case, owned by the workflow engine. Saving replaces the previous checkpoint.
 */
public interface ICaseFlowCheckpointStore {

    Mono<Void> initialize();

    Mono<Void> shutdown();

    Mono<CaseFlowWorkflowCheckpoint> save(CaseFlowWorkflowCheckpoint checkpoint);

    Mono<CaseFlowWorkflowCheckpoint> findByCaseId(String caseId);

    Mono<Boolean> deleteByCaseId(String caseId);

    Mono<Map<CaseFlowExecutionState, Long>> countByState();
}
