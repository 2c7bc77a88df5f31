package com.caseflow.orchestrator.integration.models.cases;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@Jacksonized
public class CaseFlowCaseCreateRequest {

    @NotBlank(message = "caseId must not be blank")
    @Size(max = 128, message = "caseId must be at most 128 characters")
    @Pattern(regexp = "[A-Za-z0-9._-]+", message = "caseId may only contain letters, digits, '.', '_' and '-'")
    private final String caseId;

    @NotNull(message = "inputs must not be null")
    @Builder.Default
    private final Map<String, String> inputs = new LinkedHashMap<>();
}
