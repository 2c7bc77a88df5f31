package com.caseflow.orchestrator.integration.models.run;

import com.caseflow.orchestrator.integration.models.cases.CaseFlowCase;
import com.caseflow.orchestrator.integration.models.checkpoint.CaseFlowWorkflowCheckpoint;
import com.caseflow.orchestrator.integration.models.intervention.CaseFlowInterventionRecord;
import com.caseflow.orchestrator.integration.models.status.CaseFlowActionLogEntry;
import com.caseflow.orchestrator.integration.models.status.CaseFlowStatusEntry;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class CaseFlowCaseState {

    private final CaseFlowCase caseRecord;
    private final String currentStatus;

    @Builder.Default
    private final List<CaseFlowStatusEntry> statusHistory = new ArrayList<>();

    @Builder.Default
    private final List<CaseFlowActionLogEntry> actionLog = new ArrayList<>();

    @Builder.Default
    private final List<CaseFlowInterventionRecord> interventions = new ArrayList<>();

    private final CaseFlowWorkflowCheckpoint checkpoint;
    private final boolean pollingActive;
}
