package com.caseflow.orchestrator.discharge.plugin.precondition;

import com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields;
import com.caseflow.orchestrator.integration.contract.ICaseFlowCase;
import com.caseflow.orchestrator.integration.contract.precondition.ICaseFlowPrecondition;

import java.util.List;

/**
 * A consultation needs a usable raw transcript before anything can be summarized.
 */
public class TranscriptPresentPrecondition implements ICaseFlowPrecondition {

    @Override
    public String getKind() {
        return DischargeSummaryFields.INTERVENTION_MISSING_TRANSCRIPT;
    }

    @Override
    public String getReason() {
        return "Raw transcript is missing or shorter than " + DischargeSummaryFields.MIN_TRANSCRIPT_LENGTH + " characters";
    }

    @Override
    public List<String> findMissingFields(ICaseFlowCase caseFlowCase) {
        return isUsable(caseFlowCase.getInputs().get(DischargeSummaryFields.RAW_TRANSCRIPT))
                ? List.of()
                : List.of(DischargeSummaryFields.RAW_TRANSCRIPT);
    }

    public static boolean isUsable(String rawTranscript) {
        return rawTranscript != null && rawTranscript.strip().length() >= DischargeSummaryFields.MIN_TRANSCRIPT_LENGTH;
    }
}
