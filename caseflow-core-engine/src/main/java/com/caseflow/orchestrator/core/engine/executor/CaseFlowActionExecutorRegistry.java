package com.caseflow.orchestrator.core.engine.executor;

import com.caseflow.orchestrator.core.engine.executor.impl.ErrorHandlingActionExecutor;
import com.caseflow.orchestrator.core.exception.engine.CaseFlowActionAlreadyRegistered;
import com.caseflow.orchestrator.core.exception.engine.CaseFlowActionNotFound;
import com.caseflow.orchestrator.integration.constant.CaseFlowConstants;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionExecutor;
import com.caseflow.orchestrator.integration.models.decision.CaseFlowActionDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps routing labels to action executors. The error label is always bound to the built-in
 * {@link ErrorHandlingActionExecutor}; the other reserved labels are handled by the engine
 * itself and cannot be registered.
 */
@Slf4j
public class CaseFlowActionExecutorRegistry {

    private static final Set<String> ENGINE_LABELS = Set.of(
            CaseFlowConstants.ACTION_WAIT,
            CaseFlowConstants.ACTION_RESOLVE_INTERVENTION,
            CaseFlowConstants.ACTION_COMPLETE);

    private final Map<String, ICaseFlowActionExecutor> executors = Collections.synchronizedMap(new LinkedHashMap<>());
    private final ICaseFlowActionExecutor errorExecutor;

    public CaseFlowActionExecutorRegistry() {
        this(new ErrorHandlingActionExecutor());
    }

    public CaseFlowActionExecutorRegistry(ICaseFlowActionExecutor errorExecutor) {
        this.errorExecutor = errorExecutor;
    }

    public CaseFlowActionExecutorRegistry register(ICaseFlowActionExecutor executor) {
        String label = normalize(executor.getLabel());
        if (ENGINE_LABELS.contains(label) || CaseFlowConstants.ACTION_ERROR.equals(label)) {
            throw new CaseFlowActionAlreadyRegistered(label);
        }
        if (executors.putIfAbsent(label, executor) != null) {
            throw new CaseFlowActionAlreadyRegistered(label);
        }
        log.info("Registered action executor: label={}, type={}", label, executor.getClass().getSimpleName());
        return this;
    }

    public Optional<ICaseFlowActionExecutor> find(String label) {
        if (CaseFlowConstants.ACTION_ERROR.equals(label)) {
            return Optional.of(errorExecutor);
        }
        return Optional.ofNullable(executors.get(label));
    }

    public ICaseFlowActionExecutor get(String label) {
        return find(label).orElseThrow(() -> new CaseFlowActionNotFound(label));
    }

    public ICaseFlowActionExecutor getErrorExecutor() {
        return errorExecutor;
    }

    /**
     * Every label the engine can route: the reserved ones followed by the registered step labels.
     */
    public Set<String> getRoutableLabels() {
        Set<String> labels = new LinkedHashSet<>();
        synchronized (executors) {
            labels.addAll(executors.keySet());
        }
        labels.add(CaseFlowConstants.ACTION_WAIT);
        labels.add(CaseFlowConstants.ACTION_RESOLVE_INTERVENTION);
        labels.add(CaseFlowConstants.ACTION_ERROR);
        labels.add(CaseFlowConstants.ACTION_COMPLETE);
        return labels;
    }

    public List<CaseFlowActionDescriptor> describeActions() {
        List<CaseFlowActionDescriptor> descriptors = new ArrayList<>();
        synchronized (executors) {
            executors.values().forEach(executor ->
                    descriptors.add(new CaseFlowActionDescriptor(normalize(executor.getLabel()), executor.getDescription())));
        }
        descriptors.add(new CaseFlowActionDescriptor(CaseFlowConstants.ACTION_WAIT,
                "Suspend and wait for a human to supply a missing required input"));
        descriptors.add(new CaseFlowActionDescriptor(CaseFlowConstants.ACTION_RESOLVE_INTERVENTION,
                "Mark the pending intervention resolved once the missing input has arrived"));
        descriptors.add(new CaseFlowActionDescriptor(CaseFlowConstants.ACTION_ERROR, errorExecutor.getDescription()));
        descriptors.add(new CaseFlowActionDescriptor(CaseFlowConstants.ACTION_COMPLETE,
                "Finish the workflow"));
        return descriptors;
    }

    public static String normalize(String label) {
        return label == null ? null : label.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }
}
