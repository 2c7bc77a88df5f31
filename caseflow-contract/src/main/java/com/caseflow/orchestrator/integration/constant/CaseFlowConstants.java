package com.caseflow.orchestrator.integration.constant;

public interface CaseFlowConstants {

    // Reserved action labels, always valid oracle answers
    String ACTION_WAIT = "wait";
    String ACTION_RESOLVE_INTERVENTION = "resolve_intervention";
    String ACTION_ERROR = "error";
    String ACTION_COMPLETE = "complete";

    String STATUS_UNKNOWN = "UNKNOWN";
    String STATUS_CREATED = "CREATED";
    String STATUS_INPUT_PROVIDED = "INPUT_PROVIDED";
    String STATUS_WORKFLOW_STARTED = "WORKFLOW_STARTED";
    String STATUS_WORKFLOW_RESUMED = "WORKFLOW_RESUMED";
    String STATUS_ERROR = "ERROR";
    String STATUS_AWAITING_INTERVENTION = "AWAITING_INTERVENTION";
    String STATUS_INTERVENTION_RESOLVED = "INTERVENTION_RESOLVED";
    String STATUS_COMPLETED = "COMPLETED";
    String STATUS_FAILED = "FAILED";

    /**
     * Seed message used when a workflow is started by an external trigger.
     */
    String DEFAULT_START_MESSAGE = "[SYSTEM] Workflow started";

    /**
     * Seed message used when the background poller resumes a suspended workflow.
     */
    String POLLER_RESUME_MESSAGE = "[AUTONOMOUS RESUME] Input detected by background poller. Resuming workflow.";

    String DEFAULT_REASONING = "No reasoning provided";
}
