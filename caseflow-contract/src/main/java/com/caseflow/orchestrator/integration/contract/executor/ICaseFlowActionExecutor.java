package com.caseflow.orchestrator.integration.contract.executor;

import reactor.core.publisher.Mono;

/**
 * One business step of a case workflow.
 *
 * <p>Implementations must be idempotent: running twice against the same persisted case state
 * must leave the same derived state behind. They read only the fields they need, fail fast with
 * a {@link com.caseflow.orchestrator.integration.exception.CaseFlowPreconditionException} before
 * writing anything when an input is absent, and write their derived fields together with exactly
 * one status entry inside a single transaction.
 *
 * <p>Executors never call the decision oracle, never choose the next step and never touch
 * the workflow checkpoint.
 */
public interface ICaseFlowActionExecutor {

    /**
     * The routing label the oracle uses to select this executor.
     */
    String getLabel();

    /**
     * Short description shown to the oracle in the list of available actions.
     */
    String getDescription();

    Mono<ICaseFlowActionResult> execute(String caseId, ICaseFlowActionContext context);
}
