package com.caseflow.orchestrator.core.engine.polling;

import reactor.core.publisher.Mono;

/**
 * Re-enters the workflow of a case after its missing input arrived.
 */
@FunctionalInterface
public interface ICaseFlowResumeHandler {
    Mono<?> resume(String caseId, String seedMessage);
}
