package com.caseflow.orchestrator.core.engine.oracle;

import com.caseflow.orchestrator.integration.models.decision.CaseFlowActionDescriptor;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecisionContext;

import java.util.List;
import java.util.Map;

/**
 * Renders a {@link CaseFlowDecisionContext} as the plain-text prompt sent to the oracle transport.
 */
public class CaseFlowDecisionPromptRenderer {

    public String render(CaseFlowDecisionContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are the central orchestrator of a case workflow. Choose the single next action.\n\n");

        prompt.append("CURRENT STATE:\n");
        prompt.append("- Case ID: ").append(context.getCaseId()).append('\n');
        prompt.append("- Current Status: ").append(context.getCurrentStatus()).append('\n');
        for (Map.Entry<String, Object> fact : context.getFacts().entrySet()) {
            prompt.append("- ").append(fact.getKey()).append(": ").append(fact.getValue()).append('\n');
        }
        List<String> completed = context.getCompletedActions();
        prompt.append("- Completed Actions: ").append(completed.isEmpty() ? "None" : String.join(", ", completed)).append("\n\n");

        List<String> recent = context.getRecentMessages();
        prompt.append("WORKFLOW HISTORY: ").append(recent.isEmpty() ? "None" : String.join(" | ", recent)).append("\n\n");

        prompt.append("AVAILABLE ACTIONS:\n");
        int index = 1;
        for (CaseFlowActionDescriptor action : context.getAvailableActions()) {
            prompt.append(index++).append(". \"").append(action.getLabel()).append("\" - ")
                    .append(action.getDescription()).append('\n');
        }

        prompt.append("\nDECISION RULES:\n");
        for (String rule : context.getDecisionRules()) {
            prompt.append("- ").append(rule).append('\n');
        }
        prompt.append("- DO NOT repeat completed actions\n\n");

        prompt.append("Respond with ONLY a JSON object:\n")
                .append("{\n")
                .append("    \"action\": \"one of the actions above\",\n")
                .append("    \"reasoning\": \"brief explanation\"\n")
                .append("}\n\n")
                .append("No markdown formatting.\n");
        return prompt.toString();
    }
}
