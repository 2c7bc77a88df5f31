package com.caseflow.orchestrator.core.engine.executor.impl;

import com.caseflow.orchestrator.integration.constant.CaseFlowConstants;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionContext;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionExecutor;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionResult;
import com.caseflow.orchestrator.integration.models.action.CaseFlowActionResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Records that the workflow went through error handling. Writes the ERROR status; the engine
 * decides again afterwards.
 */
@Slf4j
public class ErrorHandlingActionExecutor implements ICaseFlowActionExecutor {

    public static final String TRACE_MESSAGE = "[ERROR HANDLER] Error recorded, returning to decision";

    @Override
    public String getLabel() {
        return CaseFlowConstants.ACTION_ERROR;
    }

    @Override
    public String getDescription() {
        return "Record an error and decide again";
    }

    @Override
    public Mono<ICaseFlowActionResult> execute(String caseId, ICaseFlowActionContext context) {
        return context.inTransaction(caseId, transaction -> {
            transaction.appendStatus(CaseFlowConstants.STATUS_ERROR);
            log.debug("Error handled for caseId={}", caseId);
            return (ICaseFlowActionResult) CaseFlowActionResult.of(CaseFlowConstants.STATUS_ERROR, TRACE_MESSAGE);
        });
    }
}
