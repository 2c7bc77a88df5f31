package com.caseflow.orchestrator.integration.contract.executor;

import com.caseflow.orchestrator.integration.contract.ICaseFlowCaseTransaction;
import com.caseflow.orchestrator.integration.contract.ICaseFlowObjectMapper;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Services the engine hands to an action executor for one invocation.
 */
public interface ICaseFlowActionContext {

    /**
     * Runs {@code work} inside a transaction on the given case. The writes are committed when
     * {@code work} returns and discarded when it throws.
     */
    <T> Mono<T> inTransaction(String caseId, Function<ICaseFlowCaseTransaction, T> work);

    ICaseFlowObjectMapper getObjectMapper();
}
