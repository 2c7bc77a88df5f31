package com.caseflow.orchestrator.integration;

import com.caseflow.orchestrator.integration.contract.oracle.ICaseFlowOracleTransport;
import com.caseflow.orchestrator.integration.contract.plugin.ICaseFlowWorkflowPlugin;

/**
 * Discovered through {@link java.util.ServiceLoader}; plugin jars register their provider under
 * {@code META-INF/services/com.caseflow.orchestrator.integration.ICaseFlowPluginProvider}.
 */
public interface ICaseFlowPluginProvider {
    ICaseFlowWorkflowPlugin create();

    /**
     * Creates the plugin for an orchestrator that was given a text model transport. Plugins whose
     * executors call a language model build them on {@code languageModel}; it is {@code null} when
     * the orchestrator only has a decision oracle.
     */
    default ICaseFlowWorkflowPlugin create(ICaseFlowOracleTransport languageModel) {
        return create();
    }
}
