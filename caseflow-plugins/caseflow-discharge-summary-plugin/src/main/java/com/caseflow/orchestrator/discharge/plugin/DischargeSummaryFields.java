package com.caseflow.orchestrator.discharge.plugin;

public interface DischargeSummaryFields {

    // Inputs
    String RAW_TRANSCRIPT = "raw_transcript";

    // Artifacts
    String CLEANED_TRANSCRIPT = "cleaned_transcript";
    String DISCHARGE_SUMMARY = "discharge_summary";
    String SUMMARY_SOURCE_HASH = "summary_source_hash";
    String VALIDATION = "validation";
    String DOCTOR_NOTIFIED = "doctor_notified";

    // Action labels
    String ACTION_CLEANUP = "cleanup";
    String ACTION_SUMMARIZE = "summarize";
    String ACTION_VALIDATE = "validate";
    String ACTION_NOTIFY = "notify";

    // Status labels
    String STATUS_CLEANED = "CLEANED";
    String STATUS_SUMMARY_GENERATED = "SUMMARY_GENERATED";
    String STATUS_VALIDATED = "VALIDATED";
    String STATUS_VALIDATION_FAILED = "VALIDATION_FAILED";
    String STATUS_NOTIFIED_DOCTOR = "NOTIFIED_DOCTOR";

    String INTERVENTION_MISSING_TRANSCRIPT = "MISSING_TRANSCRIPT";

    /**
     * Shortest raw transcript, after trimming, that counts as present.
     */
    int MIN_TRANSCRIPT_LENGTH = 50;
}
