package com.caseflow.orchestrator.integration.models.intervention;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowInterventionStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A request for a human to supply missing input. At most one record per case is PENDING;
 * resolved records are kept for audit and survive deletion of the case.
 */
@Data
@Builder(toBuilder = true)
@With
@Jacksonized
public class CaseFlowInterventionRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String interventionId;
    private final String caseId;
    private final String kind;
    private final String reason;

    @Builder.Default
    private final List<String> missingFields = new ArrayList<>();

    private final CaseFlowInterventionStatus status;

    /**
     * True while a polling loop is armed for this record.
     */
    private final boolean pollingActive;

    private final int pollCount;

    private final String resolution;

    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant resolvedAt;

    @JsonIgnore
    public boolean isPending() {
        return status == CaseFlowInterventionStatus.PENDING;
    }
}
