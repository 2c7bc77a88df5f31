package com.caseflow.orchestrator.integration.models.decision;

import lombok.Builder;
import lombok.Data;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;

/**
 * A routing decision. {@code action} is always a label the engine can route; when the engine
 * replaced what the oracle answered, {@code forced} is set and {@code originalAction} keeps the answer.
 */
@Data
@Builder(toBuilder = true)
@With
@Jacksonized
public class CaseFlowDecision implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String action;
    private final String reasoning;
    private final boolean forced;
    private final String originalAction;

    public static CaseFlowDecision of(String action, String reasoning) {
        return CaseFlowDecision.builder().action(action).reasoning(reasoning).build();
    }
}
