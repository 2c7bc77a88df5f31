package com.caseflow.orchestrator.core.engine.executor;

import com.caseflow.orchestrator.core.engine.store.ICaseFlowCaseStore;
import com.caseflow.orchestrator.integration.contract.ICaseFlowCaseTransaction;
import com.caseflow.orchestrator.integration.contract.ICaseFlowObjectMapper;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionContext;
import lombok.AllArgsConstructor;
import reactor.core.publisher.Mono;

import java.util.function.Function;

@AllArgsConstructor
public class CaseFlowActionContext implements ICaseFlowActionContext {

    private final ICaseFlowCaseStore caseStore;
    private final ICaseFlowObjectMapper objectMapper;

    @Override
    public <T> Mono<T> inTransaction(String caseId, Function<ICaseFlowCaseTransaction, T> work) {
        return caseStore.inTransaction(caseId, work);
    }

    @Override
    public ICaseFlowObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
