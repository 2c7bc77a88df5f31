package com.caseflow.orchestrator.discharge.plugin.summary;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured discharge summary extracted from a cleaned consultation transcript.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class DischargeSummary {

    private final String chiefComplaint;

    @Builder.Default
    private final List<String> history = new ArrayList<>();

    private final String examFindings;

    @Builder.Default
    private final List<String> diagnosis = new ArrayList<>();

    @Builder.Default
    private final List<String> investigations = new ArrayList<>();

    @Builder.Default
    private final List<Medication> medications = new ArrayList<>();

    private final String followUpInstructions;
}
