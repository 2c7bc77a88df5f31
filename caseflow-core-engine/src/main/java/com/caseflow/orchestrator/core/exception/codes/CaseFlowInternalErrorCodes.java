package com.caseflow.orchestrator.core.exception.codes;

import com.caseflow.orchestrator.integration.contract.ICaseFlowErrorInfo;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowErrorCategory;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum CaseFlowInternalErrorCodes implements ICaseFlowErrorInfo {

    ORACLE_TRANSPORT_FAILED(
            "CASEFLOW_ERR_0001",
            CaseFlowErrorCategory.ORACLE_PATH,
            "Decision oracle call failed: {reason}"
    ),

    ORACLE_RESPONSE_UNPARSEABLE(
            "CASEFLOW_ERR_0002",
            CaseFlowErrorCategory.ORACLE_PATH,
            "Decision oracle response could not be parsed: {reason}"
    ),

    ORACLE_UNKNOWN_ACTION(
            "CASEFLOW_ERR_0003",
            CaseFlowErrorCategory.ORACLE_PATH,
            "Decision oracle returned unknown action '{action}'"
    ),

    ACTION_PRECONDITION_FAILED(
            "CASEFLOW_ERR_0010",
            CaseFlowErrorCategory.PRECONDITION,
            "Action '{action}' requires missing fields: {fields}"
    ),

    ACTION_EXECUTION_FAILED(
            "CASEFLOW_ERR_0011",
            CaseFlowErrorCategory.ACTION,
            "Action '{action}' failed: {reason}"
    ),

    ACTION_NOT_FOUND(
            "CASEFLOW_ERR_0012",
            CaseFlowErrorCategory.NOT_FOUND,
            "No executor registered for action '{action}'"
    ),

    ACTION_ALREADY_REGISTERED(
            "CASEFLOW_ERR_0013",
            CaseFlowErrorCategory.CONFLICT,
            "An executor is already registered for action '{action}'"
    ),

    CASE_NOT_FOUND(
            "CASEFLOW_ERR_0020",
            CaseFlowErrorCategory.NOT_FOUND,
            "Case '{caseId}' not found"
    ),

    CASE_ALREADY_EXISTS(
            "CASEFLOW_ERR_0021",
            CaseFlowErrorCategory.CONFLICT,
            "Case '{caseId}' already exists"
    ),

    PERSISTENCE_FAILED(
            "CASEFLOW_ERR_0022",
            CaseFlowErrorCategory.PERSISTENCE,
            "Storage operation '{operation}' failed for case '{caseId}'"
    ),

    STEP_LIMIT_EXCEEDED(
            "CASEFLOW_ERR_0030",
            CaseFlowErrorCategory.LOOP_GUARD,
            "Step ceiling of {maxSteps} reached for case '{caseId}'"
    ),

    REPEATED_ACTION(
            "CASEFLOW_ERR_0031",
            CaseFlowErrorCategory.LOOP_GUARD,
            "Action '{action}' already completed in this run of case '{caseId}'"
    ),

    CASE_LOCKED(
            "CASEFLOW_ERR_0040",
            CaseFlowErrorCategory.CONFLICT,
            "Case '{caseId}' is locked by {owner}"
    ),

    VALIDATION_FAILED(
            "CASEFLOW_ERR_0050",
            CaseFlowErrorCategory.VALIDATION,
            "Validation failed: {violations}"
    ),

    INVALID_CONFIGURATION(
            "CASEFLOW_ERR_0051",
            CaseFlowErrorCategory.VALIDATION,
            "Invalid configuration: {reason}"
    ),

    NO_INPUT_FIELD(
            "CASEFLOW_ERR_0052",
            CaseFlowErrorCategory.VALIDATION,
            "Case '{caseId}' has no pending intervention and no primary input field is configured"
    )

    ;

    private final String errorCode;
    private final CaseFlowErrorCategory category;
    private final String errorTemplate;
}
