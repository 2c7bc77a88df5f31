package com.caseflow.orchestrator.discharge.plugin;

import com.caseflow.orchestrator.discharge.plugin.executors.CleanupActionExecutor;
import com.caseflow.orchestrator.discharge.plugin.executors.NotifyDoctorActionExecutor;
import com.caseflow.orchestrator.discharge.plugin.executors.SummarizeActionExecutor;
import com.caseflow.orchestrator.discharge.plugin.executors.ValidateActionExecutor;
import com.caseflow.orchestrator.discharge.plugin.notification.IDoctorNotificationService;
import com.caseflow.orchestrator.discharge.plugin.notification.LoggingDoctorNotificationService;
import com.caseflow.orchestrator.discharge.plugin.precondition.TranscriptPresentPrecondition;
import com.caseflow.orchestrator.discharge.plugin.summary.ChatModelDischargeSummaryGenerator;
import com.caseflow.orchestrator.discharge.plugin.summary.IDischargeSummaryGenerator;
import com.caseflow.orchestrator.integration.ICaseFlowPluginProvider;
import com.caseflow.orchestrator.integration.contract.ICaseFlowCase;
import com.caseflow.orchestrator.integration.contract.oracle.ICaseFlowOracleTransport;
import com.caseflow.orchestrator.integration.contract.plugin.ICaseFlowWorkflowPlugin;
import com.caseflow.orchestrator.integration.models.CaseFlowWorkflowPlugin;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.CLEANED_TRANSCRIPT;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.DISCHARGE_SUMMARY;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.DOCTOR_NOTIFIED;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.RAW_TRANSCRIPT;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.VALIDATION;

/**
 * Medical discharge-summary workflow: a consultation transcript is cleaned, summarized,
 * validated and handed to the doctor.
 *
 * <p>When the orchestrator discovers this provider through {@link java.util.ServiceLoader} it
 * passes its oracle transport to {@link #create(ICaseFlowOracleTransport)}, and summaries are
 * generated on that same language model while doctor notifications go to the log. A plugin built
 * with the no-argument constructor and {@link #create()} has no summary generator, so summarize
 * fails with {@link DischargeSummaryErrorCodes#GENERATOR_UNAVAILABLE}; pass one explicitly through
 * the two-argument constructor in that case.
 */
@Slf4j
public class DischargeSummaryWorkflowPlugin implements ICaseFlowPluginProvider {

    public static final String IDENTIFIER = "discharge-summary";

    private final IDischargeSummaryGenerator summaryGenerator;
    private final IDoctorNotificationService notificationService;

    public DischargeSummaryWorkflowPlugin() {
        this(null, new LoggingDoctorNotificationService());
    }

    public DischargeSummaryWorkflowPlugin(IDischargeSummaryGenerator summaryGenerator,
                                          IDoctorNotificationService notificationService) {
        this.summaryGenerator = summaryGenerator;
        this.notificationService = notificationService;
    }

    @Override
    public ICaseFlowWorkflowPlugin create(ICaseFlowOracleTransport languageModel) {
        if (summaryGenerator != null || languageModel == null) {
            return create();
        }
        return new DischargeSummaryWorkflowPlugin(new ChatModelDischargeSummaryGenerator(languageModel),
                notificationService).create();
    }

    @Override
    public ICaseFlowWorkflowPlugin create() {
        if (summaryGenerator == null) {
            log.warn("Discharge summary plugin created without a summary generator, summarize will fail");
        }
        return CaseFlowWorkflowPlugin
                .builder()
                .identifier(IDENTIFIER)
                .description("Generates and validates discharge summaries from consultation transcripts")
                .primaryInputField(RAW_TRANSCRIPT)
                .executor(CleanupActionExecutor::new)
                .executor(() -> new SummarizeActionExecutor(summaryGenerator))
                .executor(ValidateActionExecutor::new)
                .executor(() -> new NotifyDoctorActionExecutor(notificationService))
                .preconditions()
                .precondition(new TranscriptPresentPrecondition())
                .decisionRule("If NO raw transcript (< " + DischargeSummaryFields.MIN_TRANSCRIPT_LENGTH + " chars): choose \"wait\"")
                .decisionRule("If a transcript arrived while an intervention is still pending: choose \"resolve_intervention\"")
                .decisionRule("If raw transcript exists but NOT cleaned: choose \"cleanup\"")
                .decisionRule("If cleaned but NO summary: choose \"summarize\"")
                .decisionRule("If summary exists but NOT validated: choose \"validate\"")
                .decisionRule("If validated but NOT notified: choose \"notify\"")
                .decisionRule("If all done: choose \"complete\"")
                .caseDescriber(DischargeSummaryWorkflowPlugin::describe)
                .build();
    }

    static Map<String, Object> describe(ICaseFlowCase caseFlowCase) {
        String raw = caseFlowCase.getInputs().get(RAW_TRANSCRIPT);
        Map<String, Object> artifacts = caseFlowCase.getArtifacts();
        Object summary = artifacts.get(DISCHARGE_SUMMARY);
        Object validation = artifacts.get(VALIDATION);

        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put("Has Raw Transcript", TranscriptPresentPrecondition.isUsable(raw)
                + " (" + (raw == null ? 0 : raw.length()) + " chars)");
        facts.put("Has Cleaned Transcript", artifacts.containsKey(CLEANED_TRANSCRIPT));
        facts.put("Discharge Summary Exists", summary != null);
        if (summary instanceof Map) {
            Map<?, ?> document = (Map<?, ?>) summary;
            facts.put("History Items", size(document.get("history")));
            facts.put("Diagnosis Items", size(document.get("diagnosis")));
            facts.put("Exam Findings", document.get("examFindings") == null ? "Missing" : "Present");
            facts.put("Medications", size(document.get("medications")));
            facts.put("Follow-up", document.get("followUpInstructions") == null ? "Missing" : "Present");
        }
        facts.put("Validated", validation instanceof Map
                ? String.valueOf(((Map<?, ?>) validation).get("valid"))
                : "Not yet");
        facts.put("Doctor Notified", Boolean.TRUE.equals(artifacts.get(DOCTOR_NOTIFIED)));
        return facts;
    }

    private static int size(Object value) {
        return value instanceof Collection ? ((Collection<?>) value).size() : 0;
    }
}
