package com.caseflow.orchestrator.integration.models.decision;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the decision oracle is allowed to see about a case when choosing the next action.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li><b>currentStatus:</b> label of the newest status entry</li>
 *   <li><b>facts:</b> presence and size of inputs and artifacts, plus plugin supplied facts</li>
 *   <li><b>completedActions:</b> actions already completed in the current run, in completion order</li>
 *   <li><b>recentMessages:</b> the last few trace messages of the run</li>
 *   <li><b>availableActions:</b> every label the engine can route, with a description</li>
 * </ul>
 */
@Data
@Builder
public class CaseFlowDecisionContext {

    private final String caseId;

    private final String currentStatus;

    @Builder.Default
    private final Map<String, Object> facts = new LinkedHashMap<>();

    @Builder.Default
    private final List<String> completedActions = new ArrayList<>();

    @Builder.Default
    private final List<String> recentMessages = new ArrayList<>();

    @Builder.Default
    private final List<CaseFlowActionDescriptor> availableActions = new ArrayList<>();

    @Builder.Default
    private final List<String> decisionRules = new ArrayList<>();
}
