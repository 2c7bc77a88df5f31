package com.caseflow.orchestrator.core.engine.fixtures;

import com.caseflow.orchestrator.core.engine.oracle.ICaseFlowDecisionOracle;
import com.caseflow.orchestrator.integration.constant.CaseFlowConstants;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecision;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowDecisionContext;
import reactor.core.publisher.Mono;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Decision oracle for tests. Answers either from a fixed script or from a policy over the context,
 * and records every context it was asked about.
 */
public class ScriptedDecisionOracle implements ICaseFlowDecisionOracle {

    private final Function<CaseFlowDecisionContext, String> policy;
    private final List<CaseFlowDecisionContext> contexts = Collections.synchronizedList(new ArrayList<>());

    private ScriptedDecisionOracle(Function<CaseFlowDecisionContext, String> policy) {
        this.policy = policy;
    }

    /**
     * Answers the given actions in order, then {@code complete} forever.
     */
    public static ScriptedDecisionOracle sequence(String... actions) {
        Deque<String> script = new ArrayDeque<>(Arrays.asList(actions));
        return new ScriptedDecisionOracle(context -> {
            synchronized (script) {
                return script.isEmpty() ? CaseFlowConstants.ACTION_COMPLETE : script.poll();
            }
        });
    }

    public static ScriptedDecisionOracle always(String action) {
        return new ScriptedDecisionOracle(context -> action);
    }

    public static ScriptedDecisionOracle following(Function<CaseFlowDecisionContext, String> policy) {
        return new ScriptedDecisionOracle(policy);
    }

    @Override
    public Mono<CaseFlowDecision> decide(CaseFlowDecisionContext context) {
        return Mono.fromCallable(() -> {
            contexts.add(context);
            String action = policy.apply(context);
            return CaseFlowDecision.of(action, "scripted step " + contexts.size());
        });
    }

    public List<CaseFlowDecisionContext> getContexts() {
        synchronized (contexts) {
            return new ArrayList<>(contexts);
        }
    }

    public int getDecisionCount() {
        return contexts.size();
    }
}
