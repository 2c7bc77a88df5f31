package com.caseflow.orchestrator.discharge.plugin.executors;

import com.caseflow.orchestrator.discharge.plugin.DischargeSummaryErrorCodes;
import com.caseflow.orchestrator.discharge.plugin.summary.DischargeSummary;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionContext;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionExecutor;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionResult;
import com.caseflow.orchestrator.integration.exception.CaseFlowPreconditionException;
import com.caseflow.orchestrator.integration.models.action.CaseFlowActionResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.ACTION_VALIDATE;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.DISCHARGE_SUMMARY;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.STATUS_VALIDATED;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.STATUS_VALIDATION_FAILED;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.VALIDATION;

/**
 * Checks that the discharge summary carries every section a doctor needs and stores the result.
 */
@Slf4j
public class ValidateActionExecutor implements ICaseFlowActionExecutor {

    public static final String CHECK_HISTORY = "has_history";
    public static final String CHECK_DIAGNOSIS = "has_diagnosis";
    public static final String CHECK_EXAM_FINDINGS = "has_exam_findings";
    public static final String CHECK_MEDICATIONS = "has_medications";
    public static final String CHECK_FOLLOW_UP = "has_followup";

    @Override
    public String getLabel() {
        return ACTION_VALIDATE;
    }

    @Override
    public String getDescription() {
        return "Validate the discharge summary (requires summary)";
    }

    @Override
    public Mono<ICaseFlowActionResult> execute(String caseId, ICaseFlowActionContext context) {
        return context.inTransaction(caseId, transaction -> {
            Object document = transaction.getArtifact(DISCHARGE_SUMMARY)
                    .orElseThrow(() -> new CaseFlowPreconditionException(
                            DischargeSummaryErrorCodes.SUMMARY_MISSING, ACTION_VALIDATE, List.of(DISCHARGE_SUMMARY)));
            DischargeSummary summary = context.getObjectMapper().convertValue(document, DischargeSummary.class);

            Map<String, Boolean> checks = check(summary);
            List<String> missing = new ArrayList<>();
            checks.forEach((check, passed) -> {
                if (!passed) {
                    missing.add(check);
                }
            });
            boolean valid = missing.isEmpty();

            Map<String, Object> validation = new LinkedHashMap<>();
            validation.put("valid", valid);
            validation.put("checks", checks);
            validation.put("missing", missing);
            transaction.putArtifact(VALIDATION, validation);

            String status = valid ? STATUS_VALIDATED : STATUS_VALIDATION_FAILED;
            transaction.appendStatus(status);
            log.info("Validation of caseId={}: valid={}, missing={}", caseId, valid, missing);
            String message = valid
                    ? "[VALIDATE] All required fields are present"
                    : "[VALIDATE] Missing fields: " + String.join(", ", missing);
            return (ICaseFlowActionResult) CaseFlowActionResult.of(status, message);
        });
    }

    static Map<String, Boolean> check(DischargeSummary summary) {
        Map<String, Boolean> checks = new LinkedHashMap<>();
        checks.put(CHECK_HISTORY, hasItems(summary.getHistory()));
        checks.put(CHECK_DIAGNOSIS, hasItems(summary.getDiagnosis()));
        checks.put(CHECK_EXAM_FINDINGS, hasText(summary.getExamFindings()));
        checks.put(CHECK_MEDICATIONS, summary.getMedications() != null && !summary.getMedications().isEmpty());
        checks.put(CHECK_FOLLOW_UP, hasText(summary.getFollowUpInstructions()));
        return checks;
    }

    private static boolean hasItems(List<String> items) {
        return items != null && !items.isEmpty();
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
