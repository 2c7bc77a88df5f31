package com.caseflow.orchestrator.core.engine.store.impl;

import com.caseflow.orchestrator.core.engine.store.ICaseFlowCheckpointStore;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowExecutionState;
import com.caseflow.orchestrator.integration.models.checkpoint.CaseFlowWorkflowCheckpoint;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCheckpointStore implements ICaseFlowCheckpointStore {

    protected final Map<String, CaseFlowWorkflowCheckpoint> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> initialize() {
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.empty();
    }

    @Override
    public Mono<CaseFlowWorkflowCheckpoint> save(CaseFlowWorkflowCheckpoint checkpoint) {
        return Mono.fromCallable(() -> {
            persist(checkpoint);
            checkpoints.put(checkpoint.getCaseId(), checkpoint);
            return checkpoint;
        });
    }

    @Override
    public Mono<CaseFlowWorkflowCheckpoint> findByCaseId(String caseId) {
        return Mono.fromCallable(() -> checkpoints.get(caseId));
    }

    @Override
    public Mono<Boolean> deleteByCaseId(String caseId) {
        return Mono.fromCallable(() -> {
            unpersist(caseId);
            return checkpoints.remove(caseId) != null;
        });
    }

    @Override
    public Mono<Map<CaseFlowExecutionState, Long>> countByState() {
        return Mono.fromCallable(() -> {
            Map<CaseFlowExecutionState, Long> counts = new EnumMap<>(CaseFlowExecutionState.class);
            for (CaseFlowWorkflowCheckpoint checkpoint : checkpoints.values()) {
                counts.merge(checkpoint.getExecutionState(), 1L, Long::sum);
            }
            return counts;
        });
    }

    protected void persist(CaseFlowWorkflowCheckpoint checkpoint) throws Exception {
        // memory only
    }

    protected void unpersist(String caseId) throws Exception {
        // memory only
    }
}
