package com.caseflow.orchestrator.discharge.plugin.summary;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

@Data
@Builder
@Jacksonized
public class Medication {
    private final String name;
    private final String dose;
    private final String frequency;
}
