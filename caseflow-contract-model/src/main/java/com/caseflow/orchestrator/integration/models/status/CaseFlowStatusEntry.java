package com.caseflow.orchestrator.integration.models.status;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;

/**
 * One row of a case's append-only status log. Entries are ordered by {@code sequence},
 * which is unique and increasing per case.
 */
@Data
@Builder
@Jacksonized
public class CaseFlowStatusEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String caseId;
    private final String label;
    private final long sequence;
    private final Instant timestamp;
}
