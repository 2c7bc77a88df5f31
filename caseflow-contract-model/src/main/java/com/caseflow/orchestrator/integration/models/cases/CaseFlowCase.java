package com.caseflow.orchestrator.integration.models.cases;

import com.caseflow.orchestrator.integration.contract.ICaseFlowCase;
import lombok.Builder;
import lombok.Data;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The domain record a workflow operates on. Inputs arrive from outside, artifacts are derived
 * by action executors. The case id never changes once the case is created.
 */
@Data
@Builder(toBuilder = true)
@With
@Jacksonized
public class CaseFlowCase implements ICaseFlowCase, Serializable {

    private static final long serialVersionUID = 1L;

    private final String caseId;

    @Builder.Default
    private final Map<String, String> inputs = new LinkedHashMap<>();

    @Builder.Default
    private final Map<String, Object> artifacts = new LinkedHashMap<>();

    /**
     * Incremented by every committed transaction.
     */
    private final long version;

    private final Instant createdAt;

    private final Instant updatedAt;
}
