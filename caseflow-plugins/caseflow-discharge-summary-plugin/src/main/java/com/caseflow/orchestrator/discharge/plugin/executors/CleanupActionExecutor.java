package com.caseflow.orchestrator.discharge.plugin.executors;

import com.caseflow.orchestrator.discharge.plugin.DischargeSummaryErrorCodes;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionContext;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionExecutor;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionResult;
import com.caseflow.orchestrator.integration.exception.CaseFlowPreconditionException;
import com.caseflow.orchestrator.integration.models.action.CaseFlowActionResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;

import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.ACTION_CLEANUP;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.CLEANED_TRANSCRIPT;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.RAW_TRANSCRIPT;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.STATUS_CLEANED;

/**
 * Stores the stripped raw transcript as the cleaned transcript.
 */
@Slf4j
public class CleanupActionExecutor implements ICaseFlowActionExecutor {

    static final String TRACE_MESSAGE = "[CLEANUP] Transcript cleaned";

    @Override
    public String getLabel() {
        return ACTION_CLEANUP;
    }

    @Override
    public String getDescription() {
        return "Clean the raw transcript (requires raw transcript)";
    }

    @Override
    public Mono<ICaseFlowActionResult> execute(String caseId, ICaseFlowActionContext context) {
        return context.inTransaction(caseId, transaction -> {
            String raw = transaction.getInput(RAW_TRANSCRIPT).orElse(null);
            if (raw == null || raw.isBlank()) {
                throw new CaseFlowPreconditionException(DischargeSummaryErrorCodes.TRANSCRIPT_MISSING, ACTION_CLEANUP,
                        List.of(RAW_TRANSCRIPT));
            }
            String cleaned = raw.strip();
            transaction.putArtifact(CLEANED_TRANSCRIPT, cleaned);
            transaction.appendStatus(STATUS_CLEANED);
            log.debug("Cleaned transcript for caseId={}: {} -> {} chars", caseId, raw.length(), cleaned.length());
            return (ICaseFlowActionResult) CaseFlowActionResult.of(STATUS_CLEANED, TRACE_MESSAGE);
        });
    }
}
