package com.caseflow.orchestrator.discharge.plugin.summary;

import reactor.core.publisher.Mono;

public interface IDischargeSummaryGenerator {

    /**
     * Produces a normalized summary of {@code cleanedTranscript}. Every list field except
     * investigations and medications is non-empty.
     */
    Mono<DischargeSummary> generate(String cleanedTranscript);
}
