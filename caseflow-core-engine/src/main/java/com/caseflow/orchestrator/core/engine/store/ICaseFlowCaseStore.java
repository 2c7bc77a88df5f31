package com.caseflow.orchestrator.core.engine.store;

import com.caseflow.orchestrator.integration.contract.ICaseFlowCaseTransaction;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCase;
import com.caseflow.orchestrator.integration.models.intervention.CaseFlowInterventionRecord;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.function.Function;

/**
 * Persistence for cases, their status and action logs, and their intervention records.
 *
 * <p>Every mutation of a case goes through {@link #inTransaction}: the work function sees a
 * staged copy of the case, and its writes become visible atomically when it returns. Storage
 * failures surface as {@link com.caseflow.orchestrator.core.exception.store.CaseFlowPersistenceException}
 * with the last committed state left intact.
 */
public interface ICaseFlowCaseStore extends ICaseFlowStatusLog {

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    Mono<Void> initialize();

    Mono<Void> shutdown();

    Mono<Boolean> healthCheck();

    // ========================================================================
    // CASES
    // ========================================================================

    /**
     * Creates a case and records its CREATED status in the same commit.
     *
     * @throws com.caseflow.orchestrator.core.exception.store.CaseFlowCaseAlreadyExists as an error signal
     */
    Mono<CaseFlowCase> createCase(String caseId, Map<String, String> inputs);

    Mono<CaseFlowCase> findCase(String caseId);

    Mono<Boolean> exists(String caseId);

    /**
     * Removes the case with its status and action logs. Intervention records are retained.
     */
    Mono<Boolean> deleteCase(String caseId);

    Mono<Long> countCases();

    Flux<String> findAllCaseIds();

    /**
     * Runs {@code work} against a staged copy of the case and commits its writes when it returns.
     * A {@code null} result completes the returned Mono empty after committing.
     *
     * @throws com.caseflow.orchestrator.core.exception.store.CaseFlowCaseNotFound as an error signal
     */
    <T> Mono<T> inTransaction(String caseId, Function<ICaseFlowCaseTransaction, T> work);

    // ========================================================================
    // INTERVENTIONS
    // ========================================================================

    Mono<CaseFlowInterventionRecord> saveIntervention(CaseFlowInterventionRecord record);

    Mono<CaseFlowInterventionRecord> findPendingIntervention(String caseId);

    Flux<CaseFlowInterventionRecord> findInterventions(String caseId);

    /**
     * Pending records still flagged as polled, used to re-arm loops after a restart.
     */
    Flux<CaseFlowInterventionRecord> findPolledInterventions();

    Mono<Long> countPendingInterventions();
}
