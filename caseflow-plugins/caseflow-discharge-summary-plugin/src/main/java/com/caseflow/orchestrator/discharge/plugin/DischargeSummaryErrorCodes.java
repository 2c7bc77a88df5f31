package com.caseflow.orchestrator.discharge.plugin;

import com.caseflow.orchestrator.integration.contract.ICaseFlowErrorInfo;
import com.caseflow.orchestrator.integration.enumerations.CaseFlowErrorCategory;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum DischargeSummaryErrorCodes implements ICaseFlowErrorInfo {

    TRANSCRIPT_MISSING(
            "DISCHARGE_ERR_0001",
            CaseFlowErrorCategory.PRECONDITION,
            "Action '{action}' needs a raw transcript of at least 50 characters: {fields}"
    ),

    CLEANED_TRANSCRIPT_MISSING(
            "DISCHARGE_ERR_0002",
            CaseFlowErrorCategory.PRECONDITION,
            "Action '{action}' needs a cleaned transcript: {fields}"
    ),

    SUMMARY_MISSING(
            "DISCHARGE_ERR_0003",
            CaseFlowErrorCategory.PRECONDITION,
            "Action '{action}' needs a discharge summary: {fields}"
    ),

    GENERATOR_UNAVAILABLE(
            "DISCHARGE_ERR_0010",
            CaseFlowErrorCategory.ACTION,
            "No discharge summary generator is configured"
    ),

    SUMMARY_GENERATION_FAILED(
            "DISCHARGE_ERR_0011",
            CaseFlowErrorCategory.ACTION,
            "Discharge summary generation failed: {reason}"
    ),

    NOTIFICATION_FAILED(
            "DISCHARGE_ERR_0012",
            CaseFlowErrorCategory.ACTION,
            "Doctor notification failed for case '{caseId}': {reason}"
    )

    ;

    private final String errorCode;
    private final CaseFlowErrorCategory category;
    private final String errorTemplate;
}
