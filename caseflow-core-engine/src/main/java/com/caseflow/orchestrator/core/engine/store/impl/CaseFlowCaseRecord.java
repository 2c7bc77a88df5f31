package com.caseflow.orchestrator.core.engine.store.impl;

import com.caseflow.orchestrator.integration.models.cases.CaseFlowCase;
import com.caseflow.orchestrator.integration.models.status.CaseFlowActionLogEntry;
import com.caseflow.orchestrator.integration.models.status.CaseFlowStatusEntry;
import lombok.Builder;
import lombok.Data;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Storage unit of a case: the case itself with its status history and action log.
 * {@code nextSequence} numbers both logs so that their entries interleave in write order.
 */
@Data
@Builder(toBuilder = true)
@With
@Jacksonized
public class CaseFlowCaseRecord {

    private final CaseFlowCase caseFlowCase;

    @Builder.Default
    private final List<CaseFlowStatusEntry> statusHistory = new ArrayList<>();

    @Builder.Default
    private final List<CaseFlowActionLogEntry> actionLog = new ArrayList<>();

    private final long nextSequence;
}
