package com.caseflow.orchestrator.integration.contract;

import java.time.Instant;
import java.util.Map;

/**
 * Read view of a case: the inputs supplied from outside and the artifacts derived by action executors.
 */
public interface ICaseFlowCase {
    String getCaseId();
    Map<String, String> getInputs();
    Map<String, Object> getArtifacts();
    long getVersion();
    Instant getCreatedAt();
    Instant getUpdatedAt();
}
