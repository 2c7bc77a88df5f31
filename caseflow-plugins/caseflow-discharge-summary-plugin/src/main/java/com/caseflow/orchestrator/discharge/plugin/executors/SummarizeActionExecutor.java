package com.caseflow.orchestrator.discharge.plugin.executors;

import com.caseflow.orchestrator.discharge.plugin.DischargeSummaryErrorCodes;
import com.caseflow.orchestrator.discharge.plugin.summary.DischargeSummary;
import com.caseflow.orchestrator.discharge.plugin.summary.IDischargeSummaryGenerator;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionContext;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionExecutor;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionResult;
import com.caseflow.orchestrator.integration.exception.CaseFlowActionRuntimeException;
import com.caseflow.orchestrator.integration.exception.CaseFlowPreconditionException;
import com.caseflow.orchestrator.integration.models.action.CaseFlowActionResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.ACTION_SUMMARIZE;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.CLEANED_TRANSCRIPT;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.DISCHARGE_SUMMARY;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.STATUS_SUMMARY_GENERATED;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.SUMMARY_SOURCE_HASH;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.VALIDATION;

/**
 * Extracts a structured discharge summary from the cleaned transcript.
 *
 * <p>The SHA-256 of the transcript the summary was built from is stored next to it; when the
 * cleaned transcript has not changed since, the generator is not called again. A regenerated
 * summary drops any earlier validation result.
 */
@Slf4j
public class SummarizeActionExecutor implements ICaseFlowActionExecutor {

    static final String TRACE_MESSAGE = "[SUMMARIZE] Medical information extracted";
    static final String UNCHANGED_TRACE_MESSAGE = "[SUMMARIZE] Summary already up to date";

    private final IDischargeSummaryGenerator generator;

    public SummarizeActionExecutor(IDischargeSummaryGenerator generator) {
        this.generator = generator;
    }

    @Override
    public String getLabel() {
        return ACTION_SUMMARIZE;
    }

    @Override
    public String getDescription() {
        return "Extract medical info from transcript (requires cleaned transcript)";
    }

    @Override
    public Mono<ICaseFlowActionResult> execute(String caseId, ICaseFlowActionContext context) {
        return context.inTransaction(caseId, transaction -> new SummarySource(
                        transaction.getArtifact(CLEANED_TRANSCRIPT).map(String::valueOf).orElse(null),
                        transaction.getArtifact(SUMMARY_SOURCE_HASH).map(String::valueOf).orElse(null),
                        transaction.getArtifact(DISCHARGE_SUMMARY).isPresent()))
                .flatMap(source -> {
                    if (source.cleanedTranscript() == null || source.cleanedTranscript().isBlank()) {
                        return Mono.error(new CaseFlowPreconditionException(
                                DischargeSummaryErrorCodes.CLEANED_TRANSCRIPT_MISSING, ACTION_SUMMARIZE, List.of(CLEANED_TRANSCRIPT)));
                    }
                    String hash = sha256(source.cleanedTranscript());
                    if (source.summaryPresent() && hash.equals(source.sourceHash())) {
                        log.info("Summary of caseId={} is current, skipping generation", caseId);
                        return context.inTransaction(caseId, transaction -> {
                            transaction.appendStatus(STATUS_SUMMARY_GENERATED);
                            return (ICaseFlowActionResult) CaseFlowActionResult.of(STATUS_SUMMARY_GENERATED, UNCHANGED_TRACE_MESSAGE);
                        });
                    }
                    return generate(source.cleanedTranscript())
                            .flatMap(summary -> store(caseId, context, summary, hash));
                });
    }

    private Mono<DischargeSummary> generate(String cleanedTranscript) {
        if (generator == null) {
            return Mono.error(new CaseFlowActionRuntimeException(DischargeSummaryErrorCodes.GENERATOR_UNAVAILABLE));
        }
        return Mono.defer(() -> generator.generate(cleanedTranscript))
                .switchIfEmpty(Mono.error(() -> new CaseFlowActionRuntimeException(
                        DischargeSummaryErrorCodes.SUMMARY_GENERATION_FAILED, Map.of("reason", "generator returned nothing"))))
                .onErrorMap(e -> !(e instanceof CaseFlowActionRuntimeException),
                        e -> new CaseFlowActionRuntimeException(DischargeSummaryErrorCodes.SUMMARY_GENERATION_FAILED,
                                Map.of("reason", String.valueOf(e.getMessage())), e, null));
    }

    @SuppressWarnings("unchecked")
    private Mono<ICaseFlowActionResult> store(String caseId, ICaseFlowActionContext context, DischargeSummary summary, String hash) {
        Map<String, Object> summaryDocument = context.getObjectMapper().convertValue(summary, Map.class);
        return context.inTransaction(caseId, transaction -> {
            transaction.putArtifact(DISCHARGE_SUMMARY, summaryDocument);
            transaction.putArtifact(SUMMARY_SOURCE_HASH, hash);
            transaction.removeArtifact(VALIDATION);
            transaction.appendStatus(STATUS_SUMMARY_GENERATED);
            log.info("Discharge summary stored for caseId={}: {} diagnoses, {} medications",
                    caseId, summary.getDiagnosis().size(), summary.getMedications().size());
            return (ICaseFlowActionResult) CaseFlowActionResult.of(STATUS_SUMMARY_GENERATED, TRACE_MESSAGE);
        });
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private record SummarySource(String cleanedTranscript, String sourceHash, boolean summaryPresent) {}
}
