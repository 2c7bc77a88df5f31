package com.caseflow.orchestrator.core.engine.store;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowLogType;
import com.caseflow.orchestrator.integration.models.status.CaseFlowActionLogEntry;
import com.caseflow.orchestrator.integration.models.status.CaseFlowStatusEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only, per-case status history and action log. Entries are totally ordered by their
 * per-case sequence number and are never rewritten.
 */
public interface ICaseFlowStatusLog {

    Mono<CaseFlowStatusEntry> appendStatus(String caseId, String label);

    /**
     * Label of the newest status entry, or {@code UNKNOWN} when the case has none.
     */
    Mono<String> findCurrentStatus(String caseId);

    Flux<CaseFlowStatusEntry> findStatusHistory(String caseId);

    Mono<CaseFlowActionLogEntry> appendLog(String caseId, String message, CaseFlowLogType logType);

    Flux<CaseFlowActionLogEntry> findActionLog(String caseId);
}
