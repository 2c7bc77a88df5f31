package com.caseflow.orchestrator.core.engine.store.impl;

import com.caseflow.orchestrator.integration.models.intervention.CaseFlowInterventionRecord;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Case store without persistence. Suitable for tests and for deployments where cases need not
 * survive a restart.
 */
@Slf4j
public class InMemoryCaseStore extends AbstractCaseFlowCaseStore {

    public InMemoryCaseStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCaseStore(Clock clock) {
        super(clock);
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.fromRunnable(() -> log.info("In-memory case store initialized"));
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> log.info("In-memory case store shut down with {} cases", records.size()));
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.just(true);
    }

    @Override
    protected void persistRecord(CaseFlowCaseRecord record) {
        // committed by the map update in the base class
    }

    @Override
    protected void removeRecord(String caseId) {
        // nothing outside the map
    }

    @Override
    protected void persistInterventions(String caseId, List<CaseFlowInterventionRecord> records) {
        // nothing outside the map
    }

    /**
     * Clears all data (for testing).
     */
    public void clear() {
        records.clear();
        interventions.clear();
    }
}
