package com.caseflow.orchestrator.core.engine.polling;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowPollOutcome;
import com.caseflow.orchestrator.integration.models.intervention.CaseFlowInterventionRecord;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Owns human-intervention records and the background loops that watch for the missing input.
 *
 * <p>There is at most one loop per case. Cancellation is cooperative: a stopped loop notices
 * on its next wake-up and exits without touching the case.
 */
public interface ICaseFlowPollingManager {

    /**
     * Creates the case's PENDING intervention, or refreshes the existing one, and arms a polling
     * loop unless one is already running for the case.
     */
    Mono<CaseFlowInterventionRecord> raiseIntervention(String caseId, String kind, String reason, List<String> missingFields);

    /**
     * Marks the pending intervention RESOLVED and stops the case's loop. Completes empty when
     * nothing was pending.
     */
    Mono<CaseFlowInterventionRecord> resolveIntervention(String caseId, String resolution);

    /**
     * Idempotent; emits whether a loop was running.
     */
    Mono<Boolean> stopPolling(String caseId);

    /**
     * Runs one polling tick now, on the calling thread, for a case with an active loop.
     */
    Mono<CaseFlowPollOutcome> pollNow(String caseId);

    /**
     * Re-arms loops for pending interventions still flagged as polled, e.g. after a restart.
     */
    Mono<Integer> recoverPolling();

    boolean isPolling(String caseId);

    List<String> getActivePolls();

    void setResumeHandler(ICaseFlowResumeHandler resumeHandler);

    void start();

    void stop();
}
