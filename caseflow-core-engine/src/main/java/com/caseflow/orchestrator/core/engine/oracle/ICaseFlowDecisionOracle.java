package com.caseflow.orchestrator.core.engine.oracle;

import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecision;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecisionContext;
import reactor.core.publisher.Mono;

/**
 * Chooses the next action of a case. Implementations never signal an error: any failure to
 * obtain a usable answer is reported as an {@code error} decision with an explanatory reasoning.
 */
@FunctionalInterface
public interface ICaseFlowDecisionOracle {
    Mono<CaseFlowDecision> decide(CaseFlowDecisionContext context);
}
