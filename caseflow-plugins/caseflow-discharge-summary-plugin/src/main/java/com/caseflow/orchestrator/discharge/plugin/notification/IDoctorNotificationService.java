package com.caseflow.orchestrator.discharge.plugin.notification;

import com.caseflow.orchestrator.discharge.plugin.summary.DischargeSummary;
import reactor.core.publisher.Mono;

public interface IDoctorNotificationService {

    /**
     * Tells the responsible doctor that the discharge summary of a case is ready for review.
     */
    Mono<Void> notifyDoctor(String caseId, DischargeSummary summary, boolean validated);
}
