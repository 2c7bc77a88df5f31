package com.caseflow.orchestrator.integration.models.run;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowExecutionState;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
public class CaseFlowStatistics {

    private final long totalCases;
    private final long pendingInterventions;

    @Builder.Default
    private final List<String> activePolls = new ArrayList<>();

    @Builder.Default
    private final Map<CaseFlowExecutionState, Long> checkpointsByState = new EnumMap<>(CaseFlowExecutionState.class);

    @JsonIgnore
    public int getActivePollCount() {
        return activePolls.size();
    }
}
