package com.caseflow.orchestrator.integration.models.action;

import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionResult;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor(staticName = "of")
public class CaseFlowActionResult implements ICaseFlowActionResult {
    private final String statusLabel;
    private final String traceMessage;
}
