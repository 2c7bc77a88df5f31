package com.caseflow.orchestrator.core.engine.store.impl;

import com.caseflow.orchestrator.integration.contract.ICaseFlowCase;
import com.caseflow.orchestrator.integration.contract.ICaseFlowCaseTransaction;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowLogType;
import com.caseflow.orchestrator.integration.models.cases.CaseFlowCase;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Working copy of one case. Writes are staged here and applied by the store on commit.
 */
public class CaseFlowCaseTransaction implements ICaseFlowCaseTransaction {

    @Getter
    private final CaseFlowCase original;
    private final Map<String, String> inputs;
    private final Map<String, Object> artifacts;
    private final List<String> stagedStatuses = new ArrayList<>();
    private final List<StagedLog> stagedLogs = new ArrayList<>();
    private boolean caseModified;

    public CaseFlowCaseTransaction(CaseFlowCase original) {
        this.original = original;
        this.inputs = new LinkedHashMap<>(original.getInputs());
        this.artifacts = new LinkedHashMap<>(original.getArtifacts());
    }

    @Override
    public String getCaseId() {
        return original.getCaseId();
    }

    @Override
    public ICaseFlowCase getCase() {
        return original.toBuilder()
                .inputs(Collections.unmodifiableMap(new LinkedHashMap<>(inputs)))
                .artifacts(Collections.unmodifiableMap(new LinkedHashMap<>(artifacts)))
                .build();
    }

    @Override
    public Optional<String> getInput(String name) {
        return Optional.ofNullable(inputs.get(name));
    }

    @Override
    public Optional<Object> getArtifact(String name) {
        return Optional.ofNullable(artifacts.get(name));
    }

    @Override
    public void putInput(String name, String value) {
        Objects.requireNonNull(name, "name");
        if (!Objects.equals(inputs.put(name, value), value)) {
            caseModified = true;
        }
    }

    @Override
    public void putArtifact(String name, Object value) {
        Objects.requireNonNull(name, "name");
        if (!Objects.equals(artifacts.put(name, value), value)) {
            caseModified = true;
        }
    }

    @Override
    public void removeArtifact(String name) {
        if (artifacts.remove(name) != null) {
            caseModified = true;
        }
    }

    @Override
    public void appendStatus(String label) {
        stagedStatuses.add(Objects.requireNonNull(label, "label"));
    }

    @Override
    public void log(String message, CaseFlowLogType logType) {
        stagedLogs.add(new StagedLog(message, logType == null ? CaseFlowLogType.INFO : logType));
    }

    public boolean isCaseModified() {
        return caseModified;
    }

    public Map<String, String> getStagedInputs() {
        return inputs;
    }

    public Map<String, Object> getStagedArtifacts() {
        return artifacts;
    }

    public List<String> getStagedStatuses() {
        return stagedStatuses;
    }

    public List<StagedLog> getStagedLogs() {
        return stagedLogs;
    }

    public record StagedLog(String message, CaseFlowLogType logType) {}
}
