package com.caseflow.orchestrator.core.engine.precondition;

import com.caseflow.orchestrator.integration.contract.ICaseFlowCase;
import com.caseflow.orchestrator.integration.contract.precondition.ICaseFlowPrecondition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Holds the preconditions whose absence turns a wait decision into a human intervention.
 */
public class CaseFlowPreconditionRegistry {

    private final List<ICaseFlowPrecondition> preconditions = new CopyOnWriteArrayList<>();

    public CaseFlowPreconditionRegistry register(ICaseFlowPrecondition precondition) {
        preconditions.add(precondition);
        return this;
    }

    /**
     * First unmet precondition, in registration order.
     */
    public Optional<UnmetPrecondition> findFirstUnmet(ICaseFlowCase caseFlowCase) {
        for (ICaseFlowPrecondition precondition : preconditions) {
            List<String> missing = precondition.findMissingFields(caseFlowCase);
            if (!missing.isEmpty()) {
                return Optional.of(new UnmetPrecondition(precondition, List.copyOf(missing)));
            }
        }
        return Optional.empty();
    }

    /**
     * Subset of {@code fields} still unusable: reported missing by a registered precondition,
     * or absent from the case inputs altogether.
     */
    public List<String> findStillMissing(ICaseFlowCase caseFlowCase, List<String> fields) {
        Set<String> reported = new LinkedHashSet<>();
        for (ICaseFlowPrecondition precondition : preconditions) {
            reported.addAll(precondition.findMissingFields(caseFlowCase));
        }
        List<String> stillMissing = new ArrayList<>();
        for (String field : fields) {
            String value = caseFlowCase.getInputs().get(field);
            if (reported.contains(field) || value == null || value.isBlank()) {
                stillMissing.add(field);
            }
        }
        return stillMissing;
    }

    public List<ICaseFlowPrecondition> getPreconditions() {
        return List.copyOf(preconditions);
    }

    public record UnmetPrecondition(ICaseFlowPrecondition precondition, List<String> missingFields) {}
}
