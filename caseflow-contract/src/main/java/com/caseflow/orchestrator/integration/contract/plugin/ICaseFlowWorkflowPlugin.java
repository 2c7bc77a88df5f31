package com.caseflow.orchestrator.integration.contract.plugin;

import com.caseflow.orchestrator.integration.contract.ICaseFlowCase;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionExecutor;
import com.caseflow.orchestrator.integration.contract.precondition.ICaseFlowPrecondition;

import java.util.List;
import java.util.Map;

public interface ICaseFlowWorkflowPlugin {
    String getIdentifier();
    String getDescription();
    List<ICaseFlowActionExecutor> getActionExecutors();
    List<ICaseFlowPrecondition> getPreconditions();
    List<String> getDecisionRules();
    String getPrimaryInputField();
    Map<String, Object> describeCase(ICaseFlowCase caseFlowCase);
}
