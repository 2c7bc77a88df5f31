package com.caseflow.orchestrator.discharge.plugin.executors;

import com.caseflow.orchestrator.discharge.plugin.DischargeSummaryErrorCodes;
import com.caseflow.orchestrator.discharge.plugin.notification.IDoctorNotificationService;
import com.caseflow.orchestrator.discharge.plugin.summary.DischargeSummary;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionContext;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionExecutor;
import com.caseflow.orchestrator.integration.contract.executor.ICaseFlowActionResult;
import com.caseflow.orchestrator.integration.exception.CaseFlowActionRuntimeException;
import com.caseflow.orchestrator.integration.exception.CaseFlowPreconditionException;
import com.caseflow.orchestrator.integration.models.action.CaseFlowActionResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.ACTION_NOTIFY;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.DISCHARGE_SUMMARY;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.DOCTOR_NOTIFIED;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.STATUS_NOTIFIED_DOCTOR;
import static com.caseflow.orchestrator.discharge.plugin.DischargeSummaryFields.VALIDATION;

/**
 * Notifies the doctor once per case. The {@code doctor_notified} flag keeps repeated invocations
 * from sending a second notification.
 */
@Slf4j
public class NotifyDoctorActionExecutor implements ICaseFlowActionExecutor {

    private final IDoctorNotificationService notificationService;

    public NotifyDoctorActionExecutor(IDoctorNotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Override
    public String getLabel() {
        return ACTION_NOTIFY;
    }

    @Override
    public String getDescription() {
        return "Notify doctor (final step after validation)";
    }

    @Override
    public Mono<ICaseFlowActionResult> execute(String caseId, ICaseFlowActionContext context) {
        return context.inTransaction(caseId, transaction -> {
                    Object document = transaction.getArtifact(DISCHARGE_SUMMARY)
                            .orElseThrow(() -> new CaseFlowPreconditionException(
                                    DischargeSummaryErrorCodes.SUMMARY_MISSING, ACTION_NOTIFY, List.of(DISCHARGE_SUMMARY)));
                    boolean validated = transaction.getArtifact(VALIDATION)
                            .filter(Map.class::isInstance)
                            .map(validation -> Boolean.TRUE.equals(((Map<?, ?>) validation).get("valid")))
                            .orElse(false);
                    boolean notified = transaction.getArtifact(DOCTOR_NOTIFIED).map(Boolean.TRUE::equals).orElse(false);
                    return new NotifySource(context.getObjectMapper().convertValue(document, DischargeSummary.class),
                            validated, notified);
                })
                .flatMap(source -> {
                    if (source.alreadyNotified()) {
                        log.info("Doctor already notified for caseId={}", caseId);
                        return markNotified(caseId, context, "[NOTIFY] Doctor already notified for " + caseId);
                    }
                    return Mono.defer(() -> notificationService.notifyDoctor(caseId, source.summary(), source.validated()))
                            .onErrorMap(e -> new CaseFlowActionRuntimeException(DischargeSummaryErrorCodes.NOTIFICATION_FAILED,
                                    Map.of("caseId", caseId, "reason", String.valueOf(e.getMessage())), e, null))
                            .then(markNotified(caseId, context, "[NOTIFY] Doctor notified for " + caseId));
                });
    }

    private Mono<ICaseFlowActionResult> markNotified(String caseId, ICaseFlowActionContext context, String message) {
        return context.inTransaction(caseId, transaction -> {
            transaction.putArtifact(DOCTOR_NOTIFIED, Boolean.TRUE);
            transaction.appendStatus(STATUS_NOTIFIED_DOCTOR);
            return (ICaseFlowActionResult) CaseFlowActionResult.of(STATUS_NOTIFIED_DOCTOR, message);
        });
    }

    private record NotifySource(DischargeSummary summary, boolean validated, boolean alreadyNotified) {}
}
