package com.caseflow.orchestrator.integration.contract;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowLogType;

import java.util.Optional;

/**
 * A staged, single-case unit of work. Nothing written through a transaction is visible
 * to other readers until the surrounding store commits it; any error discards every write.
 */
public interface ICaseFlowCaseTransaction {

    String getCaseId();

    /**
     * Snapshot of the case including writes staged so far in this transaction.
     */
    ICaseFlowCase getCase();

    Optional<String> getInput(String name);

    Optional<Object> getArtifact(String name);

    void putInput(String name, String value);

    void putArtifact(String name, Object value);

    void removeArtifact(String name);

    /**
     * Stages a status entry. Executors append exactly one per invocation.
     */
    void appendStatus(String label);

    void log(String message, CaseFlowLogType logType);
}
