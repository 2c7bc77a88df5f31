package com.caseflow.orchestrator.integration.contract.executor;

public interface ICaseFlowActionResult {
    String getStatusLabel();
    String getTraceMessage();
}
